package com.consullo.prettyprint.print;

import com.consullo.prettyprint.consolidate.ConsolidatedNotation;
import com.consullo.prettyprint.consolidate.DelayedConsolidatedNotation;
import com.consullo.prettyprint.consolidate.IndentNode;
import com.consullo.prettyprint.core.PrettyDoc;
import com.consullo.prettyprint.core.Segment;
import com.consullo.prettyprint.core.Style;
import com.consullo.prettyprint.core.TextWidth;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Prints a whole document in one recursive pass over its consolidated notation.
 *
 * <p>
 * Much slower than {@link PrettyPrinter} but simple enough to trust, so the tests compare the
 * focused printer against it.
 * </p>
 */
final class OraclePrettyPrinter {

  // Widths are capped so that adding suffix lengths never overflows.
  private static final int MAX_WIDTH = 10_000;

  private OraclePrettyPrinter() {
  }

  static <L, C, S extends Style<S>> String print(PrettyDoc<L, C, S> doc, int width) {
    Validate.isTrue(width < MAX_WIDTH, "width must be below %d", MAX_WIDTH);
    Layout layout = new Layout();
    pp(layout, DelayedConsolidatedNotation.of(doc).eval(), 0, width);
    return layout.toString();
  }

  /**
   * Appends a notation to the layout.
   *
   * @param suffixLen width of whatever follows on the same line, or null if an end-of-line
   *     marker is followed by text there
   */
  private static <L, C, S extends Style<S>> void pp(Layout prefix,
      ConsolidatedNotation<L, C, S> note, Integer suffixLen, int width) {
    switch (note.kind()) {
      case EMPTY:
      case FOCUS_MARK:
        break;
      case TEXTUAL:
        prefix.appendText(note.textual().str());
        break;
      case END_OF_LINE:
        prefix.endsWithEol = true;
        break;
      case NEWLINE:
        prefix.appendNewline(indentString(note.indent()));
        break;
      case CHILD:
        pp(prefix, note.first().eval(), suffixLen, width);
        break;
      case CONCAT: {
        ConsolidatedNotation<L, C, S> x = note.first().eval();
        ConsolidatedNotation<L, C, S> y = note.second().eval();
        pp(prefix, x, capped(firstLineLen(y, suffixLen)), width);
        pp(prefix, y, suffixLen, width);
        break;
      }
      case CHOICE: {
        ConsolidatedNotation<L, C, S> x = note.first().eval();
        Integer firstLen = firstLineLen(x, suffixLen);
        boolean fits = firstLen != null
            && !(prefix.endsWithEol && firstLen > 0)
            && prefix.lastLineLen() + firstLen <= width;
        pp(prefix, fits ? x : note.second().eval(), suffixLen, width);
        break;
      }
      default:
        throw new IllegalStateException("Unknown kind: " + note.kind());
    }
  }

  private static <L, C, S extends Style<S>> Integer firstLineLen(
      ConsolidatedNotation<L, C, S> note, Integer suffixLen) {
    switch (note.kind()) {
      case EMPTY:
      case FOCUS_MARK:
        return suffixLen;
      case TEXTUAL:
        return suffixLen == null ? null : note.textual().width() + suffixLen;
      case END_OF_LINE:
        return suffixLen != null && suffixLen == 0 ? Integer.valueOf(0) : null;
      case NEWLINE:
        return 0;
      case CHILD:
        return firstLineLen(note.first().eval(), suffixLen);
      case CONCAT: {
        Integer ySuffix = capped(firstLineLen(note.second().eval(), suffixLen));
        return firstLineLen(note.first().eval(), ySuffix);
      }
      case CHOICE:
        return firstLineLen(note.second().eval(), suffixLen);
      default:
        throw new IllegalStateException("Unknown kind: " + note.kind());
    }
  }

  private static Integer capped(Integer len) {
    return len == null ? null : Math.min(len, MAX_WIDTH);
  }

  private static <S> String indentString(IndentNode<S> indent) {
    StringBuilder sb = new StringBuilder();
    for (Segment<S> segment : IndentNode.segments(indent)) {
      sb.append(segment.str());
    }
    return sb.toString();
  }

  private static final class Layout {

    private final List<StringBuilder> lines = new ArrayList<>();
    private boolean endsWithEol;

    Layout() {
      lines.add(new StringBuilder());
    }

    void appendText(String text) {
      if (text.isEmpty()) {
        return;
      }
      if (endsWithEol) {
        throw new IllegalStateException("Text after end of line: " + text);
      }
      lines.get(lines.size() - 1).append(text);
    }

    void appendNewline(String indentation) {
      lines.add(new StringBuilder(indentation));
      endsWithEol = false;
    }

    int lastLineLen() {
      return TextWidth.of(lines.get(lines.size() - 1).toString());
    }

    @Override
    public String toString() {
      return String.join("\n", lines);
    }
  }
}
