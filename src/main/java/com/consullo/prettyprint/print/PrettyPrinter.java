package com.consullo.prettyprint.print;

import com.consullo.prettyprint.core.PrettyDoc;
import com.consullo.prettyprint.core.Segment;
import com.consullo.prettyprint.core.Style;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for pretty printing documents.
 *
 * <p>
 * A print can be focused anywhere in the document. Only the lines around the focus are computed,
 * and only as they are asked for, so printing the visible part of a huge document is cheap: the
 * work depends on the number of lines printed and the depth of the focus, not on the size of the
 * document.
 * </p>
 *
 * <p>
 * The printer tries to, but is not guaranteed to, keep lines within the width. Each choice
 * takes its left option when the first line of that option, continued by whatever is known to
 * follow it on the same line, fits.
 * </p>
 *
 * @since 1.0
 */
public final class PrettyPrinter {

  private static final Logger LOGGER = LoggerFactory.getLogger(PrettyPrinter.class);

  private PrettyPrinter() {
  }

  /**
   * Prints a document focused just before or just after the node at {@code path}.
   *
   * @param doc document root
   * @param width desired line width
   * @param path child indices leading from the root to the focused node
   * @param seekEnd whether to focus after the node instead of before it
   * @param <L> style label type
   * @param <C> condition type
   * @param <S> style type
   * @return lines above the focus, the focused line, and lines below the focus
   * @throws com.consullo.prettyprint.core.PrintingException if the path does not exist or the
   *     document and its notations disagree
   */
  public static <L, C, S extends Style<S>> PrettyPrintResult<S> prettyPrint(
      PrettyDoc<L, C, S> doc, int width, List<Integer> path, boolean seekEnd) {
    return prettyPrint(doc, PrintingOptions.builder()
        .width(width)
        .path(path)
        .focusTarget(seekEnd ? FocusTarget.end() : FocusTarget.start())
        .build());
  }

  /**
   * Prints a document focused as the options say.
   *
   * @param doc document root
   * @param options width, path and focus target
   * @param <L> style label type
   * @param <C> condition type
   * @param <S> style type
   * @return lines above the focus, the focused line, and lines below the focus
   * @throws com.consullo.prettyprint.core.PrintingException if the path or focus target does not
   *     exist, or the document and its notations disagree
   */
  public static <L, C, S extends Style<S>> PrettyPrintResult<S> prettyPrint(
      PrettyDoc<L, C, S> doc, PrintingOptions options) {
    Validate.notNull(doc, "doc must not be null");
    Validate.notNull(options, "options must not be null");
    LOGGER.debug("Pretty printing node {} with {}", doc.id(), options);

    Printer<L, C, S> printer = Printer.create(doc, options.getWidth());
    printer.seek(doc.id(), options.getPath(), options.getFocusTarget());

    int numLeftSegments = printer.focusColumnSegments();
    Line<S> line = printer.printNextLine();
    List<Segment<S>> segments = line.segments();
    FocusedLine<S> focusedLine = new FocusedLine<>(
        segments.subList(0, numLeftSegments),
        segments.subList(numLeftSegments, segments.size()));

    return new PrettyPrintResult<>(
        new LineIterator<>(printer.upward(), true),
        focusedLine,
        new LineIterator<>(printer.downward(), false));
  }

  /**
   * Prints a whole document, ignoring styles. Only suitable for small documents.
   *
   * @param doc document root
   * @param width desired line width
   * @param <L> style label type
   * @param <C> condition type
   * @param <S> style type
   * @return the printed lines, joined by newlines
   */
  public static <L, C, S extends Style<S>> String prettyPrintToString(PrettyDoc<L, C, S> doc,
      int width) {
    PrettyPrintResult<S> result = prettyPrint(doc, width, List.of(), false);
    StringBuilder sb = new StringBuilder(result.focusedLine().toString());
    Iterator<Line<S>> below = result.linesBelow();
    while (below.hasNext()) {
      sb.append('\n').append(below.next());
    }
    return sb.toString();
  }

  /**
   * Prints a whole document into a list of lines.
   *
   * @param doc document root
   * @param width desired line width
   * @param <L> style label type
   * @param <C> condition type
   * @param <S> style type
   * @return every line of the document, top to bottom
   */
  public static <L, C, S extends Style<S>> List<Line<S>> prettyPrintLines(PrettyDoc<L, C, S> doc,
      int width) {
    PrettyPrintResult<S> result = prettyPrint(doc, width, List.of(), false);
    List<Line<S>> lines = new ArrayList<>();
    lines.add(result.focusedLine().toLine());
    result.linesBelow().forEachRemaining(lines::add);
    return lines;
  }

  /**
   * Lazily prints lines in one direction.
   */
  private static final class LineIterator<L, C, S extends Style<S>> implements Iterator<Line<S>> {

    private final Printer<L, C, S> printer;
    private final boolean upward;

    LineIterator(Printer<L, C, S> printer, boolean upward) {
      this.printer = printer;
      this.upward = upward;
    }

    @Override
    public boolean hasNext() {
      return upward ? printer.hasPrevLine() : printer.hasNextLine();
    }

    @Override
    public Line<S> next() {
      Line<S> line = upward ? printer.printPrevLine() : printer.printNextLine();
      if (line == null) {
        throw new NoSuchElementException();
      }
      return line;
    }
  }
}
