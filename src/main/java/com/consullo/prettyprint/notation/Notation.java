package com.consullo.prettyprint.notation;

import com.consullo.prettyprint.core.TextWidth;
import org.apache.commons.lang3.Validate;

/**
 * Describes how to display one kind of document node, including the alternative layouts it may
 * take.
 *
 * <p>
 * A notation is attached to a node <em>shape</em>, not to a node: every JSON array shares one
 * notation, for instance. Notations are immutable and may be shared freely. Before a notation
 * can be printed it has to pass {@link NotationValidator#validate(Notation)}.
 * </p>
 *
 * <p>
 * Variants, by {@link Kind}:
 * <ul>
 * <li>{@code EMPTY}: display nothing.</li>
 * <li>{@code NEWLINE}: start a new line, indented by the enclosing {@code INDENT}s.</li>
 * <li>{@code TEXT}: the node's text.</li>
 * <li>{@code LITERAL}: a fixed string without newlines.</li>
 * <li>{@code FLAT}: only consider single-line layouts of the body: every choice inside takes its
 * left option.</li>
 * <li>{@code INDENT}: prefix every line started inside the body with a string, optionally
 * styled by a style label.</li>
 * <li>{@code CONCAT}: one notation after the other, on the same line.</li>
 * <li>{@code CHOICE}: the left option if its first line fits, otherwise the right. By convention
 * the right option's first line is never longer than the left's.</li>
 * <li>{@code CHECK}: branch on a condition of this node, a child, or a fold neighbor.</li>
 * <li>{@code CHILD}: the child at an index (negative indices count from the end).</li>
 * <li>{@code STYLE}: apply a style label to the body.</li>
 * <li>{@code COUNT}: branch on whether the node has zero, one, or more children.</li>
 * <li>{@code FOLD}: combine the children pairwise; {@code first} displays the first child and
 * {@code join} combines {@code LEFT} (everything so far) with {@code RIGHT} (the next child).</li>
 * <li>{@code END_OF_LINE}: nothing may follow on this line (a line comment, say).</li>
 * <li>{@code FOCUS_MARK}: a position that a print may be focused on.</li>
 * </ul>
 * </p>
 *
 * @param <L> style label type
 * @param <C> condition type
 */
public final class Notation<L, C> {

  public enum Kind {
    EMPTY,
    NEWLINE,
    TEXT,
    LITERAL,
    FLAT,
    INDENT,
    CONCAT,
    CHOICE,
    CHECK,
    CHILD,
    STYLE,
    COUNT,
    FOLD,
    LEFT,
    RIGHT,
    END_OF_LINE,
    FOCUS_MARK
  }

  private final Kind kind;
  // literal text, or indentation prefix
  private final String string;
  private final int stringWidth;
  private final L styleLabel;
  private final C condition;
  private final CheckPos checkPos;
  private final int childIndex;
  private final Notation<L, C> first;
  private final Notation<L, C> second;
  private final Notation<L, C> third;

  private Notation(Kind kind, String string, L styleLabel, C condition, CheckPos checkPos,
      int childIndex, Notation<L, C> first, Notation<L, C> second, Notation<L, C> third) {
    this.kind = kind;
    this.string = string;
    this.stringWidth = string == null ? 0 : TextWidth.of(string);
    this.styleLabel = styleLabel;
    this.condition = condition;
    this.checkPos = checkPos;
    this.childIndex = childIndex;
    this.first = first;
    this.second = second;
    this.third = third;
  }

  private static <L, C> Notation<L, C> leaf(Kind kind) {
    return new Notation<>(kind, null, null, null, null, 0, null, null, null);
  }

  public static <L, C> Notation<L, C> empty() {
    return leaf(Kind.EMPTY);
  }

  public static <L, C> Notation<L, C> newline() {
    return leaf(Kind.NEWLINE);
  }

  public static <L, C> Notation<L, C> text() {
    return leaf(Kind.TEXT);
  }

  public static <L, C> Notation<L, C> literal(String literal) {
    Validate.notNull(literal, "literal must not be null");
    Validate.isTrue(literal.indexOf('\n') < 0, "literal must not contain a newline: %s", literal);
    return new Notation<>(Kind.LITERAL, literal, null, null, null, 0, null, null, null);
  }

  public static <L, C> Notation<L, C> flat(Notation<L, C> body) {
    Validate.notNull(body, "body must not be null");
    return new Notation<>(Kind.FLAT, null, null, null, null, 0, body, null, null);
  }

  /**
   * Indents every line started inside {@code body} by {@code prefix}.
   *
   * @param prefix indentation string, without newlines
   * @param styleLabel label of the style to display the prefix in, or null for the current style
   * @param body indented notation
   * @param <L> style label type
   * @param <C> condition type
   * @return indent notation
   */
  public static <L, C> Notation<L, C> indent(String prefix, L styleLabel, Notation<L, C> body) {
    Validate.notNull(prefix, "prefix must not be null");
    Validate.isTrue(prefix.indexOf('\n') < 0, "indentation must not contain a newline");
    Validate.notNull(body, "body must not be null");
    return new Notation<>(Kind.INDENT, prefix, styleLabel, null, null, 0, body, null, null);
  }

  public static <L, C> Notation<L, C> concat(Notation<L, C> left, Notation<L, C> right) {
    Validate.notNull(left, "left must not be null");
    Validate.notNull(right, "right must not be null");
    return new Notation<>(Kind.CONCAT, null, null, null, null, 0, left, right, null);
  }

  public static <L, C> Notation<L, C> choice(Notation<L, C> preferred, Notation<L, C> fallback) {
    Validate.notNull(preferred, "preferred must not be null");
    Validate.notNull(fallback, "fallback must not be null");
    return new Notation<>(Kind.CHOICE, null, null, null, null, 0, preferred, fallback, null);
  }

  public static <L, C> Notation<L, C> check(C condition, CheckPos pos, Notation<L, C> ifTrue,
      Notation<L, C> ifFalse) {
    Validate.notNull(condition, "condition must not be null");
    Validate.notNull(pos, "pos must not be null");
    Validate.notNull(ifTrue, "ifTrue must not be null");
    Validate.notNull(ifFalse, "ifFalse must not be null");
    return new Notation<>(Kind.CHECK, null, null, condition, pos, 0, ifTrue, ifFalse, null);
  }

  public static <L, C> Notation<L, C> child(int index) {
    return new Notation<>(Kind.CHILD, null, null, null, null, index, null, null, null);
  }

  public static <L, C> Notation<L, C> style(L styleLabel, Notation<L, C> body) {
    Validate.notNull(styleLabel, "styleLabel must not be null");
    Validate.notNull(body, "body must not be null");
    return new Notation<>(Kind.STYLE, null, styleLabel, null, null, 0, body, null, null);
  }

  public static <L, C> Notation<L, C> count(Notation<L, C> zero, Notation<L, C> one,
      Notation<L, C> many) {
    Validate.notNull(zero, "zero must not be null");
    Validate.notNull(one, "one must not be null");
    Validate.notNull(many, "many must not be null");
    return new Notation<>(Kind.COUNT, null, null, null, null, 0, zero, one, many);
  }

  public static <L, C> Notation<L, C> fold(Notation<L, C> first, Notation<L, C> join) {
    Validate.notNull(first, "first must not be null");
    Validate.notNull(join, "join must not be null");
    return new Notation<>(Kind.FOLD, null, null, null, null, 0, first, join, null);
  }

  public static <L, C> Notation<L, C> left() {
    return leaf(Kind.LEFT);
  }

  public static <L, C> Notation<L, C> right() {
    return leaf(Kind.RIGHT);
  }

  public static <L, C> Notation<L, C> endOfLine() {
    return leaf(Kind.END_OF_LINE);
  }

  public static <L, C> Notation<L, C> focusMark() {
    return leaf(Kind.FOCUS_MARK);
  }

  public Kind kind() {
    return kind;
  }

  /** Literal text of a {@code LITERAL}. */
  public String literal() {
    return string;
  }

  /** Indentation prefix of an {@code INDENT}. */
  public String prefix() {
    return string;
  }

  /** Display width of the literal or prefix. */
  public int stringWidth() {
    return stringWidth;
  }

  /** Style label of a {@code STYLE}, or the optional label of an {@code INDENT}. */
  public L styleLabel() {
    return styleLabel;
  }

  public C condition() {
    return condition;
  }

  public CheckPos checkPos() {
    return checkPos;
  }

  public int childIndex() {
    return childIndex;
  }

  /** Body of a {@code FLAT}, {@code INDENT} or {@code STYLE}. */
  public Notation<L, C> body() {
    return first;
  }

  /** Left side of a {@code CONCAT} or {@code CHOICE}. */
  public Notation<L, C> first() {
    return first;
  }

  /** Right side of a {@code CONCAT} or {@code CHOICE}. */
  public Notation<L, C> second() {
    return second;
  }

  public Notation<L, C> ifTrue() {
    return first;
  }

  public Notation<L, C> ifFalse() {
    return second;
  }

  public Notation<L, C> zero() {
    return first;
  }

  public Notation<L, C> one() {
    return second;
  }

  public Notation<L, C> many() {
    return third;
  }

  /** The {@code first} case of a {@code FOLD}. */
  public Notation<L, C> foldFirst() {
    return first;
  }

  /** The {@code join} case of a {@code FOLD}. */
  public Notation<L, C> join() {
    return second;
  }

  /**
   * Returns {@code this} followed by {@code other} on the same line.
   *
   * @param other notation to append
   * @return concatenation
   */
  public Notation<L, C> plus(Notation<L, C> other) {
    return concat(this, other);
  }

  /**
   * Returns a choice preferring {@code this} and falling back to {@code other}.
   *
   * @param other fallback
   * @return choice
   */
  public Notation<L, C> or(Notation<L, C> other) {
    return choice(this, other);
  }

  /**
   * Returns {@code this}, a newline, then {@code other}.
   *
   * @param other notation for the following line
   * @return vertical concatenation
   */
  public Notation<L, C> above(Notation<L, C> other) {
    return concat(concat(this, newline()), other);
  }

  @Override
  public String toString() {
    switch (kind) {
      case EMPTY:
        return "ε";
      case NEWLINE:
        return "↵";
      case TEXT:
        return "TEXT";
      case LITERAL:
        return "'" + string + "'";
      case FLAT:
        return "Flat(" + first + ")";
      case INDENT:
        return "'" + string + "'⇒(" + first + ")";
      case CONCAT:
        return first + " + " + second;
      case CHOICE:
        return "(" + first + " | " + second + ")";
      case CHECK:
        return "IfCond(" + condition + ", " + checkPos + ", " + first + " | " + second + ")";
      case CHILD:
        return "$" + childIndex;
      case STYLE:
        return "Style(" + styleLabel + ", " + first + ")";
      case COUNT:
        return "Count(zero: " + first + ", one: " + second + ", many: " + third + ")";
      case FOLD:
        return "Fold(first: " + first + ", join: " + second + ")";
      case LEFT:
        return "$Left";
      case RIGHT:
        return "$Right";
      case END_OF_LINE:
        return "EOL";
      case FOCUS_MARK:
        return "MARK";
      default:
        return kind.name();
    }
  }
}
