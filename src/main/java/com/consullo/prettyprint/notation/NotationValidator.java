package com.consullo.prettyprint.notation;

import com.consullo.prettyprint.notation.NotationException.Reason;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that a notation can be printed, and produces the {@link ValidNotation} that the printer
 * requires.
 *
 * <p>
 * Validation makes one pass over the notation, tracking whether it is inside a {@code FLAT} and
 * whether it is inside a {@code COUNT} or {@code FOLD}. It rejects:
 * <ul>
 * <li>{@code LEFT}/{@code RIGHT}, and checks on the left or right child, outside a fold's
 * {@code join};</li>
 * <li>a {@code FOLD} inside a {@code FOLD}, and a {@code COUNT} inside a {@code COUNT} or
 * {@code FOLD};</li>
 * <li>child references that cannot exist given the arity a {@code COUNT} case guarantees;</li>
 * <li>{@code TEXT} inside a {@code COUNT} or {@code FOLD};</li>
 * <li>content that can follow an {@code END_OF_LINE} on the same line;</li>
 * <li>two choices that can both affect the same line ("too choosy");</li>
 * <li>notations with no possible layout, such as a newline that is always flattened.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Options of a {@code CHOICE} that have no possible layout are removed from the result, so the
 * printer never has to consider them. Inside a {@code FLAT}, a choice is replaced by its left
 * option, or its right option if the left one is impossible.
 * </p>
 *
 * <p>
 * Children, and the accumulated {@code LEFT} of a fold, are opaque here: they count as content
 * but never as a choice or an end of line. Violations they hide are caught while printing.
 * </p>
 *
 * @since 1.0
 */
public final class NotationValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotationValidator.class);

  private enum CountCase {
    NONE,
    ZERO,
    ONE,
    MANY
  }

  private enum FoldPart {
    NONE,
    FIRST,
    JOIN
  }

  private NotationValidator() {
  }

  /**
   * Validates a notation.
   *
   * @param notation notation to validate
   * @param <L> style label type
   * @param <C> condition type
   * @return the validated, possibly simplified notation
   * @throws NotationException if the notation cannot be printed
   */
  public static <L, C> ValidNotation<L, C> validate(Notation<L, C> notation)
      throws NotationException {
    Validate.notNull(notation, "notation must not be null");
    try {
      Shape<L, C> shape = walk(notation, false, CountCase.NONE, FoldPart.NONE);
      if (!shape.possible) {
        throw new NotationException(Reason.IMPOSSIBLE, notation.toString());
      }
      return new ValidNotation<>(shape.notation);
    } catch (NotationException e) {
      LOGGER.debug("Rejected notation {}: {}", notation, e.reason());
      throw e;
    }
  }

  /**
   * Validates a notation that is known to be valid, such as one built into a program.
   *
   * @param notation notation to validate
   * @param <L> style label type
   * @param <C> condition type
   * @return the validated notation
   * @throws IllegalArgumentException if the notation is not valid
   */
  public static <L, C> ValidNotation<L, C> validateOrThrow(Notation<L, C> notation) {
    try {
      return validate(notation);
    } catch (NotationException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
  }

  private static <L, C> Shape<L, C> walk(Notation<L, C> n, boolean flat, CountCase count,
      FoldPart fold) throws NotationException {
    switch (n.kind()) {
      case EMPTY:
      case FOCUS_MARK:
        return Shape.leaf(n, false);
      case NEWLINE:
        if (flat) {
          return Shape.impossible();
        }
        return new Shape<>(n, true, true, false, false, false, false);
      case LITERAL:
        return Shape.leaf(n, !n.literal().isEmpty());
      case TEXT:
        if (count != CountCase.NONE || fold != FoldPart.NONE) {
          throw new NotationException(Reason.TEXT_INSIDE_COUNT, n.toString());
        }
        return Shape.leaf(n, true);
      case END_OF_LINE:
        return new Shape<>(n, true, false, false, false, true, false);
      case CHILD:
        checkChildIndex(n.childIndex(), count, n);
        return Shape.leaf(n, true);
      case LEFT:
        if (fold != FoldPart.JOIN) {
          throw new NotationException(Reason.LEFT_OUTSIDE_JOIN, n.toString());
        }
        return Shape.leaf(n, true);
      case RIGHT:
        if (fold != FoldPart.JOIN) {
          throw new NotationException(Reason.RIGHT_OUTSIDE_JOIN, n.toString());
        }
        return Shape.leaf(n, true);
      case FLAT: {
        Shape<L, C> body = walk(n.body(), true, count, fold);
        return body.possible ? body.rewrap(Notation.flat(body.notation)) : body;
      }
      case INDENT: {
        Shape<L, C> body = walk(n.body(), flat, count, fold);
        return body.possible
            ? body.rewrap(Notation.indent(n.prefix(), n.styleLabel(), body.notation))
            : body;
      }
      case STYLE: {
        Shape<L, C> body = walk(n.body(), flat, count, fold);
        return body.possible ? body.rewrap(Notation.style(n.styleLabel(), body.notation)) : body;
      }
      case CONCAT:
        return concat(walk(n.first(), flat, count, fold), walk(n.second(), flat, count, fold), n);
      case CHOICE:
        return choice(walk(n.first(), flat, count, fold), walk(n.second(), flat, count, fold),
            flat, n);
      case CHECK: {
        checkPos(n.checkPos(), count, fold, n);
        Shape<L, C> ifTrue = walk(n.ifTrue(), flat, count, fold);
        Shape<L, C> ifFalse = walk(n.ifFalse(), flat, count, fold);
        if (!ifTrue.possible || !ifFalse.possible) {
          return Shape.impossible();
        }
        return Shape.anyOf(
            Notation.check(n.condition(), n.checkPos(), ifTrue.notation, ifFalse.notation),
            ifTrue, ifFalse);
      }
      case COUNT: {
        if (count != CountCase.NONE || fold != FoldPart.NONE) {
          throw new NotationException(Reason.NESTED_COUNT, n.toString());
        }
        Shape<L, C> zero = walk(n.zero(), flat, CountCase.ZERO, fold);
        Shape<L, C> one = walk(n.one(), flat, CountCase.ONE, fold);
        Shape<L, C> many = walk(n.many(), flat, CountCase.MANY, fold);
        if (!zero.possible || !one.possible || !many.possible) {
          return Shape.impossible();
        }
        return Shape.anyOf(Notation.count(zero.notation, one.notation, many.notation),
            zero, one, many);
      }
      case FOLD: {
        if (fold != FoldPart.NONE) {
          throw new NotationException(Reason.NESTED_FOLD, n.toString());
        }
        Shape<L, C> first = walk(n.foldFirst(), flat, count, FoldPart.FIRST);
        Shape<L, C> join = walk(n.join(), flat, count, FoldPart.JOIN);
        if (!first.possible || !join.possible) {
          return Shape.impossible();
        }
        // zero children print nothing
        return Shape.anyOf(Notation.fold(first.notation, join.notation),
            Shape.leaf(Notation.empty(), false), first, join);
      }
      default:
        throw new IllegalStateException("Unknown notation kind: " + n.kind());
    }
  }

  private static <L, C> Shape<L, C> concat(Shape<L, C> x, Shape<L, C> y, Notation<L, C> n)
      throws NotationException {
    if (!x.possible || !y.possible) {
      return Shape.impossible();
    }
    if (x.endsWithEol && y.startsWithContent) {
      throw new NotationException(Reason.TEXT_AFTER_END_OF_LINE, n.toString());
    }
    if (x.choosyLast && y.choosyFirst) {
      throw new NotationException(Reason.TOO_CHOOSY, n.toString());
    }
    return new Shape<>(
        Notation.concat(x.notation, y.notation),
        true,
        x.alwaysNewline || y.alwaysNewline,
        x.choosyFirst || (!x.alwaysNewline && y.choosyFirst),
        y.choosyLast || (!y.alwaysNewline && x.choosyLast),
        y.endsWithEol || (x.endsWithEol && !y.alwaysNewline),
        x.startsWithContent || (!x.alwaysNewline && y.startsWithContent));
  }

  private static <L, C> Shape<L, C> choice(Shape<L, C> x, Shape<L, C> y, boolean flat,
      Notation<L, C> n) throws NotationException {
    if (!x.possible) {
      return y;
    }
    if (!y.possible || flat) {
      return x;
    }
    if (x.choosyFirst && y.choosyFirst) {
      throw new NotationException(Reason.TOO_CHOOSY, n.toString());
    }
    return new Shape<>(
        Notation.choice(x.notation, y.notation),
        true,
        x.alwaysNewline && y.alwaysNewline,
        true,
        true,
        x.endsWithEol || y.endsWithEol,
        x.startsWithContent || y.startsWithContent);
  }

  private static <L, C> void checkChildIndex(int index, CountCase count, Notation<L, C> n)
      throws NotationException {
    if (count == CountCase.ZERO) {
      throw new NotationException(Reason.CHILD_IN_COUNT_ZERO, index, n.toString());
    }
    if (count == CountCase.ONE && index != 0 && index != -1) {
      throw new NotationException(Reason.CHILD_INDEX_IN_COUNT_ONE, index, n.toString());
    }
  }

  private static <L, C> void checkPos(CheckPos pos, CountCase count, FoldPart fold,
      Notation<L, C> n) throws NotationException {
    switch (pos.kind()) {
      case CHILD:
        checkChildIndex(pos.index(), count, n);
        break;
      case LEFT_CHILD:
        if (fold != FoldPart.JOIN) {
          throw new NotationException(Reason.LEFT_CHILD_CHECK_OUTSIDE_JOIN, n.toString());
        }
        break;
      case RIGHT_CHILD:
        if (fold != FoldPart.JOIN) {
          throw new NotationException(Reason.RIGHT_CHILD_CHECK_OUTSIDE_JOIN, n.toString());
        }
        break;
      default:
        break;
    }
  }

  /**
   * What validation knows about the layouts of a sub-notation.
   */
  private static final class Shape<L, C> {

    // simplified notation; null when impossible
    final Notation<L, C> notation;
    final boolean possible;
    // every layout contains a newline
    final boolean alwaysNewline;
    // a real choice may affect the first line
    final boolean choosyFirst;
    // a real choice may affect the last line
    final boolean choosyLast;
    // some layout may end with an END_OF_LINE still in effect
    final boolean endsWithEol;
    // some layout may put content before its first newline
    final boolean startsWithContent;

    Shape(Notation<L, C> notation, boolean possible, boolean alwaysNewline, boolean choosyFirst,
        boolean choosyLast, boolean endsWithEol, boolean startsWithContent) {
      this.notation = notation;
      this.possible = possible;
      this.alwaysNewline = alwaysNewline;
      this.choosyFirst = choosyFirst;
      this.choosyLast = choosyLast;
      this.endsWithEol = endsWithEol;
      this.startsWithContent = startsWithContent;
    }

    static <L, C> Shape<L, C> impossible() {
      return new Shape<>(null, false, false, false, false, false, false);
    }

    static <L, C> Shape<L, C> leaf(Notation<L, C> n, boolean content) {
      return new Shape<>(n, true, false, false, false, false, content);
    }

    /** Combines shapes of which exactly one is chosen based on the document. */
    @SafeVarargs
    static <L, C> Shape<L, C> anyOf(Notation<L, C> n, Shape<L, C>... options) {
      boolean newline = true;
      boolean first = false;
      boolean last = false;
      boolean eol = false;
      boolean content = false;
      for (Shape<L, C> option : options) {
        newline &= option.alwaysNewline;
        first |= option.choosyFirst;
        last |= option.choosyLast;
        eol |= option.endsWithEol;
        content |= option.startsWithContent;
      }
      return new Shape<>(n, true, newline, first, last, eol, content);
    }

    Shape<L, C> rewrap(Notation<L, C> n) {
      return new Shape<>(n, possible, alwaysNewline, choosyFirst, choosyLast, endsWithEol,
          startsWithContent);
    }
  }
}
