package com.consullo.prettyprint.notation;

/**
 * Thrown when a notation fails validation.
 *
 * @since 1.0
 */
public final class NotationException extends Exception {

  private static final long serialVersionUID = 1L;

  public enum Reason {
    LEFT_OUTSIDE_JOIN,
    RIGHT_OUTSIDE_JOIN,
    LEFT_CHILD_CHECK_OUTSIDE_JOIN,
    RIGHT_CHILD_CHECK_OUTSIDE_JOIN,
    NESTED_FOLD,
    NESTED_COUNT,
    CHILD_IN_COUNT_ZERO,
    CHILD_INDEX_IN_COUNT_ONE,
    TEXT_INSIDE_COUNT,
    TEXT_AFTER_END_OF_LINE,
    TOO_CHOOSY,
    IMPOSSIBLE
  }

  private final Reason reason;
  private final int index;

  NotationException(Reason reason, int index, String construct) {
    super(describe(reason, index) + (construct == null ? "" : " At: " + construct));
    this.reason = reason;
    this.index = index;
  }

  NotationException(Reason reason, String construct) {
    this(reason, -1, construct);
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Returns the child index the error is about, or -1 if it is not about a child index.
   *
   * @return child index or -1
   */
  public int index() {
    return index;
  }

  private static String describe(Reason reason, int index) {
    switch (reason) {
      case LEFT_OUTSIDE_JOIN:
        return "Left may only be used in the join case of a Fold.";
      case RIGHT_OUTSIDE_JOIN:
        return "Right may only be used in the join case of a Fold.";
      case LEFT_CHILD_CHECK_OUTSIDE_JOIN:
        return "A check on LeftChild may only be used in the join case of a Fold.";
      case RIGHT_CHILD_CHECK_OUTSIDE_JOIN:
        return "A check on RightChild may only be used in the join case of a Fold.";
      case NESTED_FOLD:
        return "Folds may not be nested.";
      case NESTED_COUNT:
        return "Counts may not be nested, or placed inside a Fold.";
      case CHILD_IN_COUNT_ZERO:
        return "Child " + index + " referenced in the zero case of a Count.";
      case CHILD_INDEX_IN_COUNT_ONE:
        return "Child " + index + " referenced in the one case of a Count; only 0 and -1 exist.";
      case TEXT_INSIDE_COUNT:
        return "Text may not be used inside a Count or Fold, whose node has children.";
      case TEXT_AFTER_END_OF_LINE:
        return "Text or a literal can follow an EndOfLine on the same line.";
      case TOO_CHOOSY:
        return "Two independent choices may affect the same line.";
      case IMPOSSIBLE:
        return "The notation has no possible layout.";
      default:
        return reason.name();
    }
  }
}
