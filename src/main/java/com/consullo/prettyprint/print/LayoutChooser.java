package com.consullo.prettyprint.print;

import com.consullo.prettyprint.consolidate.ConsolidatedNotation;
import com.consullo.prettyprint.consolidate.DelayedConsolidatedNotation;
import com.consullo.prettyprint.core.Style;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks an option of a choice, looking no further than the end of the current line.
 */
final class LayoutChooser {

  private LayoutChooser() {
  }

  /**
   * Picks the preferred option if the first line it would produce, continued by the rest of the
   * block, fits in the width left on the block's line.
   *
   * @param width printing width
   * @param block block the choice is on
   * @param preferred left option
   * @param fallback right option
   * @return the chosen option
   */
  static <L, C, S extends Style<S>> DelayedConsolidatedNotation<L, C, S> choose(int width,
      Block<L, C, S> block, DelayedConsolidatedNotation<L, C, S> preferred,
      DelayedConsolidatedNotation<L, C, S> fallback) {
    if (width >= block.prefixWidth
        && fits(width - block.prefixWidth, preferred.eval(), block.chunks, block.endOfLine)) {
      return preferred;
    }
    return fallback;
  }

  /**
   * Determines whether the first line of {@code notation} followed by {@code nextChunks} fits in
   * {@code remaining} columns.
   *
   * <p>
   * Choices met along the way take their right option, whose first line is never longer than
   * the left option's.
   * </p>
   *
   * @param remaining columns left on the line
   * @param notation candidate notation
   * @param nextChunks chunks after the candidate; the last element is the leftmost
   * @param endOfLine whether an end of line is already in effect
   * @return whether the line fits
   */
  static <L, C, S extends Style<S>> boolean fits(int remaining,
      ConsolidatedNotation<L, C, S> notation, List<Chunk<L, C, S>> nextChunks,
      boolean endOfLine) {
    int next = nextChunks.size() - 1;
    List<ConsolidatedNotation<L, C, S>> stack = new ArrayList<>();
    stack.add(notation);
    boolean eol = endOfLine;
    while (true) {
      ConsolidatedNotation<L, C, S> n;
      if (!stack.isEmpty()) {
        n = stack.remove(stack.size() - 1);
      } else if (next >= 0) {
        n = nextChunks.get(next).notation();
        next--;
      } else {
        return true;
      }

      switch (n.kind()) {
        case EMPTY:
        case FOCUS_MARK:
          break;
        case END_OF_LINE:
          eol = true;
          break;
        case TEXTUAL:
          if (eol && !n.textual().str().isEmpty()) {
            return false;
          }
          if (n.textual().width() > remaining) {
            return false;
          }
          remaining -= n.textual().width();
          break;
        case NEWLINE:
          return true;
        case CHILD:
          stack.add(n.first().eval());
          break;
        case CONCAT:
          stack.add(n.second().eval());
          stack.add(n.first().eval());
          break;
        case CHOICE:
          stack.add(n.second().eval());
          break;
        default:
          throw new IllegalStateException("Unknown consolidated notation kind: " + n.kind());
      }
    }
  }
}
