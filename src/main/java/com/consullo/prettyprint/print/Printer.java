package com.consullo.prettyprint.print;

import com.consullo.prettyprint.consolidate.ConsolidatedNotation;
import com.consullo.prettyprint.consolidate.DelayedConsolidatedNotation;
import com.consullo.prettyprint.consolidate.Textual;
import com.consullo.prettyprint.core.PrettyDoc;
import com.consullo.prettyprint.core.PrintingException;
import com.consullo.prettyprint.core.PrintingException.Reason;
import com.consullo.prettyprint.core.Style;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The line-by-line printing engine.
 *
 * <p>
 * Output is kept as two stacks of {@link Block}s: the lines before the focus and the lines after
 * it. While seeking, the focus is the boundary between the segments and the chunks of the top
 * block of {@code nextBlocks}. Printing a line pops a block from one of the stacks and resolves
 * its chunks; resolving may split off more blocks, which land on the same side.
 * </p>
 */
final class Printer<L, C, S extends Style<S>> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Printer.class);

  private final int width;
  // Blocks before the focus. The last element is the previous line.
  private final List<Block<L, C, S>> prevBlocks;
  // Blocks after the focus. The last element is the next line.
  private final List<Block<L, C, S>> nextBlocks;

  private Printer(int width, List<Block<L, C, S>> prevBlocks, List<Block<L, C, S>> nextBlocks) {
    this.width = width;
    this.prevBlocks = prevBlocks;
    this.nextBlocks = nextBlocks;
  }

  /**
   * Creates a printer focused at the start of the document.
   */
  static <L, C, S extends Style<S>> Printer<L, C, S> create(PrettyDoc<L, C, S> doc, int width) {
    Printer<L, C, S> printer = new Printer<>(width, new ArrayList<>(), new ArrayList<>());
    Chunk<L, C, S> chunk = Chunk.of(DelayedConsolidatedNotation.of(doc));
    Block<L, C, S> block = Block.startingWith(null, new ArrayList<>());
    printer.expandFocusingFirstBlock(block, chunk);
    printer.nextBlocks.add(block);
    return printer;
  }

  /** A printer over the lines before the focus. Only {@link #printPrevLine()} applies. */
  Printer<L, C, S> upward() {
    return new Printer<>(width, prevBlocks, new ArrayList<>());
  }

  /** A printer over the lines after the focus. Only {@link #printNextLine()} applies. */
  Printer<L, C, S> downward() {
    return new Printer<>(width, new ArrayList<>(), nextBlocks);
  }

  /** Number of segments left of the focus on the focused line. */
  int focusColumnSegments() {
    return nextBlocks.get(nextBlocks.size() - 1).segments.size();
  }

  boolean hasNextLine() {
    return !nextBlocks.isEmpty();
  }

  boolean hasPrevLine() {
    return !prevBlocks.isEmpty();
  }

  /**
   * Prints the line after the focus.
   *
   * @return the line, or null at the end of the document
   */
  Line<S> printNextLine() {
    if (nextBlocks.isEmpty()) {
      return null;
    }
    Block<L, C, S> block = pop(nextBlocks);
    while (!block.chunks.isEmpty()) {
      resolve(block, block.popChunk(), false);
    }
    return block.toLine();
  }

  /**
   * Prints the line before the focus.
   *
   * @return the line, or null at the start of the document
   */
  Line<S> printPrevLine() {
    if (prevBlocks.isEmpty()) {
      return null;
    }
    Block<L, C, S> block = pop(prevBlocks);
    while (!block.chunks.isEmpty()) {
      resolve(block, block.popChunk(), true);
    }
    return block.toLine();
  }

  /**
   * Moves the focus to the node at the end of {@code path}, starting from the root. Call at most
   * once, on a freshly created printer.
   *
   * @param rootId id of the document root
   * @param path child indices from the root
   * @param target where to focus within the node
   */
  void seek(long rootId, List<Integer> path, FocusTarget target) {
    long targetId = rootId;
    for (int i = 0; i < path.size(); i++) {
      targetId = seekChild(targetId, path.get(i), i + 1 < path.size());
    }
    switch (target.kind()) {
      case START:
        break;
      case END:
        seekEnd(path.isEmpty());
        break;
      case MARK:
      case TEXT:
        seekWithin(targetId, target);
        break;
      default:
        throw new IllegalStateException("Unknown focus target: " + target);
    }
  }

  private void seekEnd(boolean wholeDoc) {
    if (wholeDoc) {
      while (nextBlocks.size() > 1) {
        prevBlocks.add(pop(nextBlocks));
      }
    }
    Block<L, C, S> block = pop(nextBlocks);
    int numChunksAfter = wholeDoc ? 0 : block.chunks.size() - 1;
    while (block.chunks.size() > numChunksAfter) {
      resolve(block, block.popChunk(), true);
    }
    nextBlocks.add(block);
  }

  /**
   * Scans forward from the focus for the mark or text of node {@code targetId}, printing the
   * lines it passes into {@code prevBlocks}. The scan stops once the node has nothing left to
   * print, so a missing mark costs no more than printing the node itself.
   */
  private void seekWithin(long targetId, FocusTarget target) {
    // The chunk at the focus is the node itself, or the parent's Child chunk leading to it.
    // Chunks of the node only ever come from resolving one of these.
    boolean entered = false;
    while (!nextBlocks.isEmpty()) {
      if (entered && !pendingChunksOf(targetId)) {
        break;
      }
      Block<L, C, S> block = pop(nextBlocks);
      while (!block.chunks.isEmpty()) {
        entered = true;
        Chunk<L, C, S> chunk = block.popChunk();
        ConsolidatedNotation<L, C, S> n = chunk.notation();
        if (chunk.id() == targetId) {
          if (target.kind() == FocusTarget.Kind.MARK
              && n.kind() == ConsolidatedNotation.Kind.FOCUS_MARK) {
            nextBlocks.add(block);
            return;
          }
          if (target.kind() == FocusTarget.Kind.TEXT
              && n.kind() == ConsolidatedNotation.Kind.TEXTUAL && n.textual().fromText()) {
            Pair<Textual<S>, Textual<S>> halves = n.textual().splitAt(target.charIndex());
            block.pushText(halves.getLeft());
            block.chunks.add(
                new Chunk<>(chunk.id(), ConsolidatedNotation.textual(halves.getRight())));
            nextBlocks.add(block);
            return;
          }
        }
        resolve(block, chunk, false);
      }
      prevBlocks.add(block);
    }
    throw PrintingException.of(target.kind() == FocusTarget.Kind.MARK
        ? Reason.MISSING_FOCUS_MARK
        : Reason.MISSING_TEXT);
  }

  private boolean pendingChunksOf(long id) {
    for (Block<L, C, S> block : nextBlocks) {
      for (Chunk<L, C, S> chunk : block.chunks) {
        if (chunk.id() == id) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Moves the focus to the left of the child at {@code childIndex} of the node {@code parentId}.
   * If {@code expandChild} is set, the child is expanded and the focus is left at its start.
   *
   * @return the id of the child
   */
  private long seekChild(long parentId, int childIndex, boolean expandChild) {
    LOGGER.trace("Seeking child {} of node {}", childIndex, parentId);
    while (true) {
      // 1. Move forward to the first block holding a Child or Choice of the parent. Whether a
      // choice contains the child can't be known until it is resolved.
      Block<L, C, S> block = null;
      while (!nextBlocks.isEmpty()) {
        Block<L, C, S> candidate = pop(nextBlocks);
        if (containsRelevantChunk(candidate, parentId, childIndex)) {
          block = candidate;
          break;
        }
        prevBlocks.add(candidate);
      }
      if (block == null) {
        throw PrintingException.invalidPath(childIndex);
      }

      // 2. Resolve up to the first Child or Choice, then go back to 1.
      boolean resolved = false;
      while (!resolved) {
        Chunk<L, C, S> chunk = block.popChunk();
        ConsolidatedNotation<L, C, S> n = chunk.notation();
        switch (n.kind()) {
          case TEXTUAL:
            block.pushText(n.textual());
            break;
          case END_OF_LINE:
            block.endOfLine = true;
            break;
          case FOCUS_MARK:
            break;
          case CHILD:
            if (chunk.id() == parentId && n.childIndex() == childIndex) {
              long childId = n.first().doc().id();
              if (expandChild) {
                expandFocusingFirstBlock(block, Chunk.of(n.first()));
              } else {
                block.chunks.add(chunk);
              }
              nextBlocks.add(block);
              return childId;
            }
            expandFocusingFirstBlock(block, Chunk.of(n.first()));
            nextBlocks.add(block);
            resolved = true;
            break;
          case CHOICE:
            DelayedConsolidatedNotation<L, C, S> choice =
                LayoutChooser.choose(width, block, n.first(), n.second());
            expandFocusingFirstBlock(block, Chunk.of(choice));
            nextBlocks.add(block);
            resolved = true;
            break;
          default:
            throw new IllegalStateException("Unexpected chunk while seeking: " + n);
        }
      }
    }
  }

  private boolean containsRelevantChunk(Block<L, C, S> block, long parentId, int childIndex) {
    for (Chunk<L, C, S> chunk : block.chunks) {
      if (chunk.id() != parentId) {
        continue;
      }
      ConsolidatedNotation<L, C, S> n = chunk.notation();
      if (n.kind() == ConsolidatedNotation.Kind.CHOICE
          || (n.kind() == ConsolidatedNotation.Kind.CHILD && n.childIndex() == childIndex)) {
        return true;
      }
    }
    return false;
  }

  private void resolve(Block<L, C, S> block, Chunk<L, C, S> chunk, boolean focusingLast) {
    ConsolidatedNotation<L, C, S> n = chunk.notation();
    switch (n.kind()) {
      case TEXTUAL:
        block.pushText(n.textual());
        break;
      case END_OF_LINE:
        block.endOfLine = true;
        break;
      case FOCUS_MARK:
        break;
      case CHILD:
        expand(block, Chunk.of(n.first()), focusingLast);
        break;
      case CHOICE:
        expand(block, Chunk.of(LayoutChooser.choose(width, block, n.first(), n.second())),
            focusingLast);
        break;
      default:
        throw new IllegalStateException("Unexpected chunk in block: " + n);
    }
  }

  private void expand(Block<L, C, S> block, Chunk<L, C, S> chunk, boolean focusingLast) {
    if (focusingLast) {
      expandFocusingLastBlock(block, chunk);
    } else {
      expandFocusingFirstBlock(block, chunk);
    }
  }

  /**
   * Expands the empties, newlines and concatenations in {@code chunk}, keeping the focus on the
   * first line of the result. Lines after the first become new blocks after the focus.
   *
   * <pre>
   * aaaaa       aaaaa      aaaaa
   * a|*|B   -&gt;  a|***  or  a|**B
   * BBBBB       ***BB      BBBBB
   *             BBBBB
   * </pre>
   */
  private void expandFocusingFirstBlock(Block<L, C, S> block, Chunk<L, C, S> chunk) {
    // | block.segments ->| stack ->|<- block.chunks |
    List<Chunk<L, C, S>> stack = new ArrayList<>();
    stack.add(chunk);
    while (!stack.isEmpty()) {
      Chunk<L, C, S> c = pop(stack);
      ConsolidatedNotation<L, C, S> n = c.notation();
      switch (n.kind()) {
        case EMPTY:
          break;
        case NEWLINE: {
          List<Chunk<L, C, S>> after = new ArrayList<>(block.chunks);
          block.chunks.clear();
          nextBlocks.add(Block.startingWith(n.indent(), after));
          break;
        }
        case CONCAT:
          stack.add(Chunk.of(n.first()));
          stack.add(Chunk.of(n.second()));
          break;
        default:
          block.chunks.add(c);
          break;
      }
    }
  }

  /**
   * Expands the empties, newlines and concatenations in {@code chunk}, keeping the focus on the
   * last line of the result. Lines before the last become new blocks before the focus.
   *
   * <pre>
   * aaaaa      aaaaa      aaaaa
   * a|*|B  -&gt;  a****  or  a|**B
   * BBBBB      |***B      BBBBB
   *            BBBBB
   * </pre>
   */
  private void expandFocusingLastBlock(Block<L, C, S> block, Chunk<L, C, S> chunk) {
    // | block.segments ->| chunks ->|<- stack |<- block.chunks |
    List<Chunk<L, C, S>> chunks = new ArrayList<>();
    List<Chunk<L, C, S>> stack = new ArrayList<>();
    stack.add(chunk);
    while (!stack.isEmpty()) {
      Chunk<L, C, S> c = pop(stack);
      ConsolidatedNotation<L, C, S> n = c.notation();
      switch (n.kind()) {
        case EMPTY:
          break;
        case NEWLINE: {
          Collections.reverse(chunks);
          int prefixWidth = block.prefixWidth;
          prevBlocks.add(new Block<>(block.takeSegments(), prefixWidth, chunks, block.endOfLine));
          chunks = new ArrayList<>();
          block.restartWith(n.indent());
          break;
        }
        case CONCAT:
          stack.add(Chunk.of(n.second()));
          stack.add(Chunk.of(n.first()));
          break;
        default:
          chunks.add(c);
          break;
      }
    }
    Collections.reverse(chunks);
    block.chunks.addAll(chunks);
  }

  private static <T> T pop(List<T> stack) {
    return stack.remove(stack.size() - 1);
  }
}
