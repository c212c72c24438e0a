package com.consullo.prettyprint.consolidate;

import com.consullo.prettyprint.core.PrettyDoc;
import com.consullo.prettyprint.core.PrintingException;
import com.consullo.prettyprint.core.PrintingException.Reason;
import com.consullo.prettyprint.core.Segment;
import com.consullo.prettyprint.core.Style;
import com.consullo.prettyprint.notation.CheckPos;
import com.consullo.prettyprint.notation.Notation;
import java.util.OptionalInt;
import org.apache.commons.lang3.Validate;

/**
 * A {@link ConsolidatedNotation} that has not been computed yet.
 *
 * <p>
 * Holds what is needed to resume walking the notation tree: the notation, the document node it
 * belongs to, whether it is flattened, the indentation and style in effect, and, inside a fold's
 * {@code join}, the position within the fold. Only the parts of the notation tree that are
 * actually printed ever get evaluated.
 * </p>
 *
 * <p>
 * Instances are never modified after construction, so {@link #eval()} may be called any number
 * of times. Each call does work proportional to the number of constructs it resolves away, which
 * is bounded by the size of the notations involved, not by the size of the document.
 * </p>
 *
 * @param <L> style label type
 * @param <C> condition type
 * @param <S> style type
 * @since 1.0
 */
public final class DelayedConsolidatedNotation<L, C, S extends Style<S>> {

  private Notation<L, C> notation;
  private PrettyDoc<L, C, S> doc;
  private boolean flat;
  private IndentNode<S> indent;
  private S style;
  private JoinPos<L, C, S> joinPos;
  // numChildren() of doc as first seen, or null if not asked yet
  private OptionalInt knownChildCount;

  /**
   * Position inside a fold's {@code join}.
   */
  private static final class JoinPos<L, C, S extends Style<S>> {
    // the node whose notation contains the fold
    final PrettyDoc<L, C, S> parent;
    // the child to the right of this join
    final PrettyDoc<L, C, S> child;
    // index of child
    final int index;
    final Notation<L, C> first;
    final Notation<L, C> join;

    JoinPos(PrettyDoc<L, C, S> parent, PrettyDoc<L, C, S> child, int index,
        Notation<L, C> first, Notation<L, C> join) {
      this.parent = parent;
      this.child = child;
      this.index = index;
      this.first = first;
      this.join = join;
    }
  }

  private DelayedConsolidatedNotation() {
  }

  private DelayedConsolidatedNotation<L, C, S> copy() {
    DelayedConsolidatedNotation<L, C, S> c = new DelayedConsolidatedNotation<>();
    c.notation = notation;
    c.doc = doc;
    c.flat = flat;
    c.indent = indent;
    c.style = style;
    c.joinPos = joinPos;
    c.knownChildCount = knownChildCount;
    return c;
  }

  /**
   * Starts at the root of a document.
   *
   * @param doc document root
   * @param <L> style label type
   * @param <C> condition type
   * @param <S> style type
   * @return the root's delayed notation
   */
  public static <L, C, S extends Style<S>> DelayedConsolidatedNotation<L, C, S> of(
      PrettyDoc<L, C, S> doc) {
    return withOptionalStyle(doc, null);
  }

  /**
   * Starts at a document node, displayed inside an enclosing style.
   *
   * @param doc document node
   * @param style enclosing style, or null for none
   * @param <L> style label type
   * @param <C> condition type
   * @param <S> style type
   * @return the node's delayed notation
   */
  public static <L, C, S extends Style<S>> DelayedConsolidatedNotation<L, C, S> withOptionalStyle(
      PrettyDoc<L, C, S> doc, S style) {
    Validate.notNull(doc, "doc must not be null");
    DelayedConsolidatedNotation<L, C, S> d = new DelayedConsolidatedNotation<>();
    d.doc = doc;
    d.notation = doc.notation().notation();
    d.flat = false;
    d.indent = null;
    d.joinPos = null;
    d.style = style == null ? doc.nodeStyle() : style.combine(doc.nodeStyle());
    return d;
  }

  /** The document node this notation belongs to. */
  public PrettyDoc<L, C, S> doc() {
    return doc;
  }

  /**
   * Walks the notation tree until it reaches one of the kinds of {@link ConsolidatedNotation}.
   *
   * @return the consolidated notation
   * @throws PrintingException if the notation and the document disagree
   */
  public ConsolidatedNotation<L, C, S> eval() {
    DelayedConsolidatedNotation<L, C, S> d = copy();
    while (true) {
      Notation<L, C> n = d.notation;
      switch (n.kind()) {
        case EMPTY:
          return ConsolidatedNotation.empty();
        case END_OF_LINE:
          return ConsolidatedNotation.endOfLine();
        case FOCUS_MARK:
          return ConsolidatedNotation.focusMark();
        case NEWLINE:
          return ConsolidatedNotation.newline(d.indent);
        case LITERAL:
          return ConsolidatedNotation.textual(
              new Textual<>(n.literal(), n.stringWidth(), d.style, false));
        case TEXT:
          if (d.numChildren().isPresent()) {
            throw PrintingException.of(Reason.TEXT_NOTATION_ON_CHILDFUL_DOC);
          }
          return ConsolidatedNotation.textual(Textual.of(d.doc.unwrapText(), d.style, true));
        case FLAT:
          d.flat = true;
          d.notation = n.body();
          break;
        case INDENT: {
          S indentStyle = n.styleLabel() == null
              ? d.style
              : d.style.combine(d.doc.lookupStyle(n.styleLabel()));
          d.indent = new IndentNode<>(new Segment<>(n.prefix(), n.stringWidth(), indentStyle),
              d.indent);
          d.notation = n.body();
          break;
        }
        case STYLE:
          d.style = d.style.combine(d.doc.lookupStyle(n.styleLabel()));
          d.notation = n.body();
          break;
        case CONCAT: {
          DelayedConsolidatedNotation<L, C, S> left = d.copy();
          left.notation = n.first();
          d.notation = n.second();
          return ConsolidatedNotation.concat(left, d);
        }
        case CHOICE: {
          if (d.flat) {
            d.notation = n.first();
            break;
          }
          DelayedConsolidatedNotation<L, C, S> preferred = d.copy();
          preferred.notation = n.first();
          d.notation = n.second();
          return ConsolidatedNotation.choice(preferred, d);
        }
        case CHECK: {
          PrettyDoc<L, C, S> inspected = d.checkedDoc(n.checkPos());
          d.notation = inspected.condition(n.condition()) ? n.ifTrue() : n.ifFalse();
          break;
        }
        case CHILD: {
          OptionalInt count = d.numChildren();
          if (count.isEmpty()) {
            throw PrintingException.of(Reason.CHILD_NOTATION_ON_TEXTUAL_DOC);
          }
          int index = normalizeChildIndex(n.childIndex(), count.getAsInt());
          if (index < 0) {
            throw PrintingException.indexOutOfBounds(Reason.CHILD_INDEX_OUT_OF_BOUNDS,
                n.childIndex(), count.getAsInt());
          }
          d.enter(d.doc.unwrapChild(index));
          return ConsolidatedNotation.child(index, d);
        }
        case COUNT: {
          OptionalInt count = d.numChildren();
          if (count.isEmpty()) {
            throw PrintingException.of(Reason.ARITY_NOTATION_ON_TEXTUAL_DOC);
          }
          switch (count.getAsInt()) {
            case 0:
              d.notation = n.zero();
              break;
            case 1:
              d.notation = n.one();
              break;
            default:
              d.notation = n.many();
              break;
          }
          break;
        }
        case FOLD: {
          OptionalInt count = d.numChildren();
          if (count.isEmpty()) {
            throw PrintingException.of(Reason.ARITY_NOTATION_ON_TEXTUAL_DOC);
          }
          int numChildren = count.getAsInt();
          if (numChildren == 0) {
            return ConsolidatedNotation.empty();
          } else if (numChildren == 1) {
            d.notation = n.foldFirst();
          } else {
            d.joinPos = new JoinPos<>(d.doc, d.doc.unwrapLastChild(), numChildren - 1,
                n.foldFirst(), n.join());
            d.notation = n.join();
          }
          break;
        }
        case LEFT: {
          JoinPos<L, C, S> pos = d.requireJoinPos();
          if (pos.index == 1) {
            d.joinPos = null;
            d.notation = pos.first;
          } else {
            PrettyDoc<L, C, S> prev = pos.child.unwrapPrevSibling(pos.parent, pos.index - 1);
            d.joinPos = new JoinPos<>(pos.parent, prev, pos.index - 1, pos.first, pos.join);
            d.notation = pos.join;
          }
          break;
        }
        case RIGHT: {
          JoinPos<L, C, S> pos = d.requireJoinPos();
          d.joinPos = null;
          d.enter(pos.child);
          return ConsolidatedNotation.child(pos.index, d);
        }
        default:
          throw new IllegalStateException("Unknown notation kind: " + n.kind());
      }
    }
  }

  private void enter(PrettyDoc<L, C, S> child) {
    doc = child;
    notation = child.notation().notation();
    style = style.combine(child.nodeStyle());
    knownChildCount = null;
  }

  private OptionalInt numChildren() {
    OptionalInt count = doc.numChildren();
    if (knownChildCount != null && !knownChildCount.equals(count)) {
      throw PrintingException.of(Reason.NUM_CHILDREN_CHANGED);
    }
    knownChildCount = count;
    return count;
  }

  private JoinPos<L, C, S> requireJoinPos() {
    if (joinPos == null) {
      throw new IllegalStateException("Left or Right used outside of a fold's join: " + notation);
    }
    return joinPos;
  }

  private PrettyDoc<L, C, S> checkedDoc(CheckPos pos) {
    switch (pos.kind()) {
      case HERE:
        return doc;
      case CHILD: {
        OptionalInt count = numChildren();
        if (count.isEmpty()) {
          throw PrintingException.of(Reason.CHECK_CHILD_ON_TEXTUAL_DOC);
        }
        int index = normalizeChildIndex(pos.index(), count.getAsInt());
        if (index < 0) {
          throw PrintingException.indexOutOfBounds(Reason.CHECK_CHILD_INDEX_OUT_OF_BOUNDS,
              pos.index(), count.getAsInt());
        }
        return doc.unwrapChild(index);
      }
      case RIGHT_CHILD:
        return requireJoinPos().child;
      case LEFT_CHILD: {
        JoinPos<L, C, S> join = requireJoinPos();
        return join.child.unwrapPrevSibling(join.parent, join.index - 1);
      }
      default:
        throw new IllegalStateException("Unknown check position: " + pos);
    }
  }

  /**
   * Turns a possibly negative child index into an index from the start.
   *
   * @param index child index; negative indices count from the end
   * @param numChildren number of children
   * @return index in {@code [0, numChildren)}, or -1 if out of range
   */
  static int normalizeChildIndex(int index, int numChildren) {
    int normalized = index < 0 ? numChildren + index : index;
    return normalized >= 0 && normalized < numChildren ? normalized : -1;
  }

  @Override
  public String toString() {
    return notation.toString();
  }
}
