package com.consullo.prettyprint.print;

import com.consullo.prettyprint.consolidate.IndentNode;
import com.consullo.prettyprint.consolidate.Textual;
import com.consullo.prettyprint.core.PrintingException;
import com.consullo.prettyprint.core.Segment;
import com.consullo.prettyprint.core.Style;
import java.util.ArrayList;
import java.util.List;

/**
 * One line of output, partly resolved.
 *
 * <pre>
 * | segments ->|<- chunks |
 * ^^^^^^^^^^^^^^
 *  prefixWidth
 * </pre>
 *
 * <p>
 * {@code prefixWidth} is always the total width of {@code segments}. The last element of
 * {@code chunks} is the leftmost chunk; chunks are only ever {@code TEXTUAL}, {@code CHOICE},
 * {@code CHILD}, {@code END_OF_LINE} or {@code FOCUS_MARK}.
 * </p>
 */
final class Block<L, C, S extends Style<S>> {

  final List<Segment<S>> segments;
  int prefixWidth;
  final List<Chunk<L, C, S>> chunks;
  // an END_OF_LINE has been resolved on this line
  boolean endOfLine;

  Block(List<Segment<S>> segments, int prefixWidth, List<Chunk<L, C, S>> chunks,
      boolean endOfLine) {
    this.segments = segments;
    this.prefixWidth = prefixWidth;
    this.chunks = chunks;
    this.endOfLine = endOfLine;
  }

  /**
   * Creates a block that starts with the given indentation.
   */
  static <L, C, S extends Style<S>> Block<L, C, S> startingWith(IndentNode<S> indent,
      List<Chunk<L, C, S>> chunks) {
    return new Block<>(IndentNode.segments(indent), IndentNode.width(indent), chunks, false);
  }

  /**
   * Replaces the resolved part of this line with the given indentation, keeping its chunks.
   */
  void restartWith(IndentNode<S> indent) {
    segments.clear();
    segments.addAll(IndentNode.segments(indent));
    prefixWidth = IndentNode.width(indent);
    endOfLine = false;
  }

  void pushText(Textual<S> textual) {
    if (endOfLine && !textual.str().isEmpty()) {
      throw PrintingException.of(PrintingException.Reason.TEXT_AFTER_END_OF_LINE);
    }
    segments.add(textual.toSegment());
    prefixWidth += textual.width();
  }

  Chunk<L, C, S> popChunk() {
    return chunks.remove(chunks.size() - 1);
  }

  Line<S> toLine() {
    if (!chunks.isEmpty()) {
      throw new IllegalStateException("Block still has " + chunks.size() + " unresolved chunks.");
    }
    return new Line<>(segments);
  }

  /** Takes the resolved part of this line, leaving it empty. */
  List<Segment<S>> takeSegments() {
    List<Segment<S>> taken = new ArrayList<>(segments);
    segments.clear();
    return taken;
  }
}
