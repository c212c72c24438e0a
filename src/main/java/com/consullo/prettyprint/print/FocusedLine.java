package com.consullo.prettyprint.print;

import com.consullo.prettyprint.core.Segment;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * The line containing the focus, split at the focus.
 *
 * @param left segments left of the focus
 * @param right segments right of the focus
 * @param <S> style type
 * @since 1.0
 */
public record FocusedLine<S>(List<Segment<S>> left, List<Segment<S>> right) {

  public FocusedLine {
    Validate.notNull(left, "left must not be null");
    Validate.notNull(right, "right must not be null");
    left = List.copyOf(left);
    right = List.copyOf(right);
  }

  public String leftString() {
    return new Line<>(left).toString();
  }

  public String rightString() {
    return new Line<>(right).toString();
  }

  /** Joins both halves into a plain line. */
  public Line<S> toLine() {
    List<Segment<S>> segments = new ArrayList<>(left);
    segments.addAll(right);
    return new Line<>(segments);
  }

  public int width() {
    return new Line<>(left).width() + new Line<>(right).width();
  }

  @Override
  public String toString() {
    return leftString() + rightString();
  }
}
