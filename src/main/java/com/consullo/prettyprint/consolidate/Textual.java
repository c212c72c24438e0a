package com.consullo.prettyprint.consolidate;

import com.consullo.prettyprint.core.Segment;
import com.consullo.prettyprint.core.TextWidth;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.tuple.Pair;

/**
 * A styled piece of text produced by a {@code LITERAL} or {@code TEXT} notation.
 *
 * @param str the text
 * @param width display width of {@code str}
 * @param style style to display the text in
 * @param fromText whether the text came from a node's text rather than a literal
 * @param <S> style type
 * @since 1.0
 */
public record Textual<S>(String str, int width, S style, boolean fromText) {

  public Textual {
    Validate.notNull(str, "str must not be null");
  }

  static <S> Textual<S> of(String str, S style, boolean fromText) {
    return new Textual<>(str, TextWidth.of(str), style, fromText);
  }

  /**
   * Splits this text at a position between characters. Positions past the end split at the end.
   *
   * @param charPos number of characters (code points) that go to the left part
   * @return the left and right parts
   */
  public Pair<Textual<S>, Textual<S>> splitAt(int charPos) {
    Validate.isTrue(charPos >= 0, "charPos must be non-negative");
    int index = charPos >= TextWidth.charCount(str)
        ? str.length()
        : str.offsetByCodePoints(0, charPos);
    return Pair.of(
        of(str.substring(0, index), style, fromText),
        of(str.substring(index), style, fromText));
  }

  public Segment<S> toSegment() {
    return new Segment<>(str, width, style);
  }
}
