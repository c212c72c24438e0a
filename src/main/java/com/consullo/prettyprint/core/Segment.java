package com.consullo.prettyprint.core;

import org.apache.commons.lang3.Validate;

/**
 * A piece of styled text in a printed line.
 *
 * @param str the text, never containing a newline
 * @param width display width of {@code str} in columns
 * @param style style to display the text in
 * @param <S> style type
 * @since 1.0
 */
public record Segment<S>(String str, int width, S style) {

  public Segment {
    Validate.notNull(str, "str must not be null");
    Validate.isTrue(width >= 0, "width must be non-negative");
  }

  /**
   * Creates a segment, measuring the width of the text.
   *
   * @param str text
   * @param style style
   * @param <S> style type
   * @return segment
   */
  public static <S> Segment<S> of(String str, S style) {
    return new Segment<>(str, TextWidth.of(str), style);
  }
}
