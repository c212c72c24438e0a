package com.consullo.prettyprint.core;

/**
 * Raised while printing when the requested path does not exist or when a document and its
 * notations disagree.
 *
 * <p>
 * Apart from {@link Reason#INVALID_PATH}, these indicate that the document implementation broke
 * its contract. They are never recovered from: the line being printed is abandoned and the
 * printer that raised the error must not be used again.
 * </p>
 */
public final class PrintingException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public enum Reason {
    INVALID_PATH,
    TEXT_NOTATION_ON_CHILDFUL_DOC,
    CHILD_INDEX_OUT_OF_BOUNDS,
    CHILD_NOTATION_ON_TEXTUAL_DOC,
    CHECK_CHILD_INDEX_OUT_OF_BOUNDS,
    CHECK_CHILD_ON_TEXTUAL_DOC,
    ARITY_NOTATION_ON_TEXTUAL_DOC,
    NUM_CHILDREN_CHANGED,
    TEXT_AFTER_END_OF_LINE,
    MISSING_FOCUS_MARK,
    MISSING_TEXT
  }

  private final Reason reason;
  private final int index;
  private final int length;

  private PrintingException(Reason reason, int index, int length, String message) {
    super(message);
    this.reason = reason;
    this.index = index;
    this.length = length;
  }

  public static PrintingException of(Reason reason) {
    return new PrintingException(reason, -1, -1, describe(reason, -1, -1));
  }

  public static PrintingException invalidPath(int childIndex) {
    return new PrintingException(Reason.INVALID_PATH, childIndex, -1,
        describe(Reason.INVALID_PATH, childIndex, -1));
  }

  public static PrintingException indexOutOfBounds(Reason reason, int index, int length) {
    return new PrintingException(reason, index, length, describe(reason, index, length));
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Returns the offending child index, or -1 if the reason does not involve one.
   *
   * @return child index or -1
   */
  public int index() {
    return index;
  }

  /**
   * Returns the number of children the node had, or -1 if the reason does not involve it.
   *
   * @return child count or -1
   */
  public int length() {
    return length;
  }

  private static String describe(Reason reason, int index, int length) {
    switch (reason) {
      case INVALID_PATH:
        return "Pretty printing path invalid at child index " + index + ".";
      case TEXT_NOTATION_ON_CHILDFUL_DOC:
        return "Notation/doc mismatch: notation was Text but the doc node has children.";
      case CHILD_INDEX_OUT_OF_BOUNDS:
        return "Notation/doc mismatch: notation was Child(" + index + ") but the doc node only had "
            + length + " children.";
      case CHILD_NOTATION_ON_TEXTUAL_DOC:
        return "Notation/doc mismatch: notation was Child but the doc node contains text.";
      case CHECK_CHILD_INDEX_OUT_OF_BOUNDS:
        return "Notation/doc mismatch: notation checked child " + index + " but the doc node only had "
            + length + " children.";
      case CHECK_CHILD_ON_TEXTUAL_DOC:
        return "Notation/doc mismatch: notation checked a child but the doc node contains text.";
      case ARITY_NOTATION_ON_TEXTUAL_DOC:
        return "Notation/doc mismatch: notation was Count or Fold but the doc node contains text.";
      case NUM_CHILDREN_CHANGED:
        return "Doc node's number of children changed between invocations.";
      case TEXT_AFTER_END_OF_LINE:
        return "Pretty printing encountered text after an EndOfLine.";
      case MISSING_FOCUS_MARK:
        return "FocusMark not found in the focused node.";
      case MISSING_TEXT:
        return "Text not found in the focused node.";
      default:
        return reason.name();
    }
  }
}
