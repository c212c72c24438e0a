package com.consullo.prettyprint.print;

import org.apache.commons.lang3.Validate;

/**
 * Where, within the node found by following the path, a print is focused.
 *
 * @since 1.0
 */
public final class FocusTarget {

  public enum Kind {
    /** Just before the node. */
    START,
    /** Just after the node. */
    END,
    /** At the node's {@code FOCUS_MARK}. */
    MARK,
    /** Inside the node's text, before the character at an index. */
    TEXT
  }

  private static final FocusTarget START = new FocusTarget(Kind.START, 0);
  private static final FocusTarget END = new FocusTarget(Kind.END, 0);
  private static final FocusTarget MARK = new FocusTarget(Kind.MARK, 0);

  private final Kind kind;
  private final int charIndex;

  private FocusTarget(Kind kind, int charIndex) {
    this.kind = kind;
    this.charIndex = charIndex;
  }

  public static FocusTarget start() {
    return START;
  }

  public static FocusTarget end() {
    return END;
  }

  public static FocusTarget mark() {
    return MARK;
  }

  /**
   * Focuses inside the node's text. Indices past the end of the text focus at its end.
   *
   * @param charIndex number of characters (code points) left of the focus
   * @return focus target
   */
  public static FocusTarget text(int charIndex) {
    Validate.isTrue(charIndex >= 0, "charIndex must be non-negative");
    return new FocusTarget(Kind.TEXT, charIndex);
  }

  public Kind kind() {
    return kind;
  }

  public int charIndex() {
    return charIndex;
  }

  @Override
  public String toString() {
    return kind == Kind.TEXT ? "TEXT(" + charIndex + ")" : kind.name();
  }
}
