package com.consullo.prettyprint.notation;

/**
 * A notation that passed {@link NotationValidator#validate(Notation)}.
 *
 * <p>
 * Only the validator creates instances. The wrapped notation may differ from the one that was
 * validated: options of a choice that can never be rendered have been removed.
 * </p>
 *
 * @param <L> style label type
 * @param <C> condition type
 * @since 1.0
 */
public final class ValidNotation<L, C> {

  private final Notation<L, C> notation;

  ValidNotation(Notation<L, C> notation) {
    this.notation = notation;
  }

  public Notation<L, C> notation() {
    return notation;
  }

  @Override
  public String toString() {
    return notation.toString();
  }
}
