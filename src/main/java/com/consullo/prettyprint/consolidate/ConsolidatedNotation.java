package com.consullo.prettyprint.consolidate;

import com.consullo.prettyprint.core.Style;

/**
 * A node of the notation tree of a whole document, with the uninteresting constructs resolved
 * away.
 *
 * <p>
 * Gluing the notations of every document node together gives one big notation tree. Evaluating a
 * {@link DelayedConsolidatedNotation} walks that tree, resolving flattening, indentation, styles,
 * checks, counts and folds on the way, and stops at the first node of one of these kinds:
 * <ul>
 * <li>{@code EMPTY}, {@code END_OF_LINE}, {@code FOCUS_MARK}: as in the notation.</li>
 * <li>{@code NEWLINE}: carries the indentation to start the next line with.</li>
 * <li>{@code TEXTUAL}: a resolved, styled piece of text.</li>
 * <li>{@code CONCAT}, {@code CHOICE}: two delayed parts.</li>
 * <li>{@code CHILD}: entering the child at a (non-negative) index, with the child's delayed
 * notation.</li>
 * </ul>
 * </p>
 *
 * @param <L> style label type
 * @param <C> condition type
 * @param <S> style type
 * @since 1.0
 */
public final class ConsolidatedNotation<L, C, S extends Style<S>> {

  public enum Kind {
    EMPTY,
    END_OF_LINE,
    NEWLINE,
    TEXTUAL,
    CONCAT,
    CHOICE,
    CHILD,
    FOCUS_MARK
  }

  private final Kind kind;
  private final IndentNode<S> indent;
  private final Textual<S> textual;
  private final int childIndex;
  private final DelayedConsolidatedNotation<L, C, S> first;
  private final DelayedConsolidatedNotation<L, C, S> second;

  private ConsolidatedNotation(Kind kind, IndentNode<S> indent, Textual<S> textual,
      int childIndex, DelayedConsolidatedNotation<L, C, S> first,
      DelayedConsolidatedNotation<L, C, S> second) {
    this.kind = kind;
    this.indent = indent;
    this.textual = textual;
    this.childIndex = childIndex;
    this.first = first;
    this.second = second;
  }

  public static <L, C, S extends Style<S>> ConsolidatedNotation<L, C, S> empty() {
    return new ConsolidatedNotation<>(Kind.EMPTY, null, null, -1, null, null);
  }

  public static <L, C, S extends Style<S>> ConsolidatedNotation<L, C, S> endOfLine() {
    return new ConsolidatedNotation<>(Kind.END_OF_LINE, null, null, -1, null, null);
  }

  public static <L, C, S extends Style<S>> ConsolidatedNotation<L, C, S> focusMark() {
    return new ConsolidatedNotation<>(Kind.FOCUS_MARK, null, null, -1, null, null);
  }

  public static <L, C, S extends Style<S>> ConsolidatedNotation<L, C, S> newline(
      IndentNode<S> indent) {
    return new ConsolidatedNotation<>(Kind.NEWLINE, indent, null, -1, null, null);
  }

  public static <L, C, S extends Style<S>> ConsolidatedNotation<L, C, S> textual(
      Textual<S> textual) {
    return new ConsolidatedNotation<>(Kind.TEXTUAL, null, textual, -1, null, null);
  }

  static <L, C, S extends Style<S>> ConsolidatedNotation<L, C, S> concat(
      DelayedConsolidatedNotation<L, C, S> left, DelayedConsolidatedNotation<L, C, S> right) {
    return new ConsolidatedNotation<>(Kind.CONCAT, null, null, -1, left, right);
  }

  static <L, C, S extends Style<S>> ConsolidatedNotation<L, C, S> choice(
      DelayedConsolidatedNotation<L, C, S> preferred,
      DelayedConsolidatedNotation<L, C, S> fallback) {
    return new ConsolidatedNotation<>(Kind.CHOICE, null, null, -1, preferred, fallback);
  }

  static <L, C, S extends Style<S>> ConsolidatedNotation<L, C, S> child(int index,
      DelayedConsolidatedNotation<L, C, S> child) {
    return new ConsolidatedNotation<>(Kind.CHILD, null, null, index, child, null);
  }

  public Kind kind() {
    return kind;
  }

  /** Indentation of a {@code NEWLINE}, or null for none. */
  public IndentNode<S> indent() {
    return indent;
  }

  public Textual<S> textual() {
    return textual;
  }

  public int childIndex() {
    return childIndex;
  }

  /** Left side of a {@code CONCAT} or {@code CHOICE}, or the child of a {@code CHILD}. */
  public DelayedConsolidatedNotation<L, C, S> first() {
    return first;
  }

  /** Right side of a {@code CONCAT} or {@code CHOICE}. */
  public DelayedConsolidatedNotation<L, C, S> second() {
    return second;
  }

  @Override
  public String toString() {
    switch (kind) {
      case EMPTY:
        return "ε";
      case END_OF_LINE:
        return "EOL";
      case FOCUS_MARK:
        return "MARK";
      case NEWLINE:
        return "↵";
      case TEXTUAL:
        return "'" + textual.str() + "'";
      case CONCAT:
        return first + " + " + second;
      case CHOICE:
        return "(" + first + " | " + second + ")";
      case CHILD:
        return "$" + childIndex;
      default:
        return kind.name();
    }
  }
}
