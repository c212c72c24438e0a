package com.consullo.prettyprint.core;

import com.consullo.prettyprint.notation.ValidNotation;
import java.util.OptionalInt;

/**
 * A node in a tree-shaped document that can be pretty printed.
 *
 * <p>This interface isolates the printing engine from any concrete tree representation. A node
 * either holds text or holds an ordered sequence of children, never both. Nodes must not change
 * while a print is in progress; the engine keeps references to them between calls to the line
 * iterators.
 *
 * <p>Any method may fail by throwing an unchecked exception of the implementation's choosing. The
 * engine does not catch these: they propagate unchanged to whoever asked for the line being
 * printed.
 *
 * @param <L> style label type used by this document's notations
 * @param <C> condition type used by this document's notations
 * @param <S> style type
 * @since 1.0
 */
public interface PrettyDoc<L, C, S extends Style<S>> {

  /**
   * Returns an identifier for this node that is unique within the document and stable for the
   * duration of a print.
   *
   * @return node id
   */
  long id();

  /**
   * Returns the notation that describes how to display this node.
   *
   * @return validated notation
   */
  ValidNotation<L, C> notation();

  /**
   * Returns the number of children, or an empty value if this node holds text instead.
   *
   * @return child count, or empty for a text node
   */
  OptionalInt numChildren();

  /**
   * Returns this node's text. Only called when {@link #numChildren()} is empty.
   *
   * @return text payload
   */
  String unwrapText();

  /**
   * Returns the child at the given index. Only called with {@code 0 <= index < numChildren()}.
   *
   * @param index child index
   * @return child node
   */
  PrettyDoc<L, C, S> unwrapChild(int index);

  /**
   * Returns the last child. Only called when this node has at least one child.
   *
   * <p>Override when the last child can be found faster than by index.
   *
   * @return last child node
   */
  default PrettyDoc<L, C, S> unwrapLastChild() {
    final OptionalInt count = numChildren();
    if (count.isEmpty() || count.getAsInt() == 0) {
      throw new IllegalStateException("unwrapLastChild called on a node without children.");
    }
    return unwrapChild(count.getAsInt() - 1);
  }

  /**
   * Returns the sibling to the left of this node, which is the child of {@code parent} at
   * {@code index}.
   *
   * <p>Override when siblings are linked and the parent lookup can be skipped.
   *
   * @param parent this node's parent
   * @param index index of the sibling within {@code parent}
   * @return previous sibling
   */
  default PrettyDoc<L, C, S> unwrapPrevSibling(final PrettyDoc<L, C, S> parent, final int index) {
    return parent.unwrapChild(index);
  }

  /**
   * Returns the style applied to this entire node.
   *
   * @return node style
   */
  S nodeStyle();

  /**
   * Returns the style for a style label used in this node's notation.
   *
   * @param label style label
   * @return style for the label
   */
  S lookupStyle(L label);

  /**
   * Evaluates a condition used by a {@code Check} notation against this node.
   *
   * @param condition condition to evaluate
   * @return whether the condition holds
   */
  boolean condition(C condition);
}
