package com.consullo.prettyprint.print;

import com.consullo.prettyprint.core.Segment;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * One printed line: styled segments displayed left to right with no space between them.
 *
 * @param segments the line's segments, leftmost first
 * @param <S> style type
 * @since 1.0
 */
public record Line<S>(List<Segment<S>> segments) {

  public Line {
    Validate.notNull(segments, "segments must not be null");
    segments = List.copyOf(segments);
  }

  /** Display width of the line in columns. */
  public int width() {
    int width = 0;
    for (Segment<S> segment : segments) {
      width += segment.width();
    }
    return width;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Segment<S> segment : segments) {
      sb.append(segment.str());
    }
    return sb.toString();
  }
}
