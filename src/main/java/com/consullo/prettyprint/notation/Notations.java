package com.consullo.prettyprint.notation;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Short constructors for building notations, intended for static import.
 *
 * <pre>{@code
 * Notation<String, Void> list = lit("[")
 *     .plus(fold(child(0), left().plus(lit(", ")).plus(right())))
 *     .plus(lit("]"));
 * }</pre>
 */
public final class Notations {

  private Notations() {
  }

  public static <L, C> Notation<L, C> empty() {
    return Notation.empty();
  }

  public static <L, C> Notation<L, C> nl() {
    return Notation.newline();
  }

  public static <L, C> Notation<L, C> text() {
    return Notation.text();
  }

  public static <L, C> Notation<L, C> lit(String literal) {
    return Notation.literal(literal);
  }

  public static <L, C> Notation<L, C> child(int index) {
    return Notation.child(index);
  }

  public static <L, C> Notation<L, C> flat(Notation<L, C> body) {
    return Notation.flat(body);
  }

  public static <L, C> Notation<L, C> indent(String prefix, L styleLabel, Notation<L, C> body) {
    return Notation.indent(prefix, styleLabel, body);
  }

  /**
   * Starts a new line indented by {@code spaces} more spaces, then displays {@code body} with
   * that indentation.
   *
   * @param spaces number of spaces to indent by
   * @param body indented notation
   * @param <L> style label type
   * @param <C> condition type
   * @return nested notation
   */
  public static <L, C> Notation<L, C> nest(int spaces, Notation<L, C> body) {
    Validate.isTrue(spaces >= 0, "spaces must be non-negative");
    return Notation.indent(StringUtils.repeat(' ', spaces), null,
        Notation.concat(Notation.newline(), body));
  }

  /**
   * Concatenates notations left to right. No arguments give {@code EMPTY}.
   *
   * @param notations notations to concatenate
   * @param <L> style label type
   * @param <C> condition type
   * @return concatenation
   */
  @SafeVarargs
  public static <L, C> Notation<L, C> concat(Notation<L, C>... notations) {
    if (notations.length == 0) {
      return Notation.empty();
    }
    Notation<L, C> result = notations[0];
    for (int i = 1; i < notations.length; i++) {
      result = Notation.concat(result, notations[i]);
    }
    return result;
  }

  /**
   * Chooses between notations, preferring earlier ones. Each later option's first line should
   * be no longer than the previous option's.
   *
   * @param options options in order of preference
   * @param <L> style label type
   * @param <C> condition type
   * @return choice
   */
  @SafeVarargs
  public static <L, C> Notation<L, C> choice(Notation<L, C>... options) {
    Validate.isTrue(options.length > 0, "choice needs at least one option");
    Notation<L, C> result = options[options.length - 1];
    for (int i = options.length - 2; i >= 0; i--) {
      result = Notation.choice(options[i], result);
    }
    return result;
  }

  /** Returns {@code top}, a newline, then {@code bottom}. */
  public static <L, C> Notation<L, C> vert(Notation<L, C> top, Notation<L, C> bottom) {
    return top.above(bottom);
  }

  public static <L, C> Notation<L, C> check(C condition, CheckPos pos, Notation<L, C> ifTrue,
      Notation<L, C> ifFalse) {
    return Notation.check(condition, pos, ifTrue, ifFalse);
  }

  public static <L, C> Notation<L, C> style(L styleLabel, Notation<L, C> body) {
    return Notation.style(styleLabel, body);
  }

  public static <L, C> Notation<L, C> count(Notation<L, C> zero, Notation<L, C> one,
      Notation<L, C> many) {
    return Notation.count(zero, one, many);
  }

  public static <L, C> Notation<L, C> fold(Notation<L, C> first, Notation<L, C> join) {
    return Notation.fold(first, join);
  }

  public static <L, C> Notation<L, C> left() {
    return Notation.left();
  }

  public static <L, C> Notation<L, C> right() {
    return Notation.right();
  }

  public static <L, C> Notation<L, C> eol() {
    return Notation.endOfLine();
  }

  public static <L, C> Notation<L, C> mark() {
    return Notation.focusMark();
  }
}
