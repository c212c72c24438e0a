package com.consullo.prettyprint.consolidate;

import com.consullo.prettyprint.core.Segment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One level of indentation, plus the level of indentation to its left.
 *
 * <p>
 * Nodes are immutable and form a tree through their parent references, so any number of pending
 * notations can share the indentation they have in common.
 * </p>
 *
 * @param <S> style type
 * @since 1.0
 */
public final class IndentNode<S> {

  private final Segment<S> segment;
  private final IndentNode<S> parent;

  IndentNode(Segment<S> segment, IndentNode<S> parent) {
    this.segment = segment;
    this.parent = parent;
  }

  /** The rightmost level of indentation. */
  public Segment<S> segment() {
    return segment;
  }

  /** The indentation to the left of this one, or null. */
  public IndentNode<S> parent() {
    return parent;
  }

  /**
   * Returns every level of indentation, leftmost first.
   *
   * @param node innermost indentation, or null for none
   * @param <S> style type
   * @return indentation segments
   */
  public static <S> List<Segment<S>> segments(IndentNode<S> node) {
    List<Segment<S>> out = new ArrayList<>();
    for (IndentNode<S> n = node; n != null; n = n.parent) {
      out.add(n.segment);
    }
    Collections.reverse(out);
    return out;
  }

  /**
   * Returns the total width of the indentation.
   *
   * @param node innermost indentation, or null for none
   * @param <S> style type
   * @return width in columns
   */
  public static <S> int width(IndentNode<S> node) {
    int width = 0;
    for (IndentNode<S> n = node; n != null; n = n.parent) {
      width += n.segment.width();
    }
    return width;
  }
}
