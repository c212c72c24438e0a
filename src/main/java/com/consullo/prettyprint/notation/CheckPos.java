package com.consullo.prettyprint.notation;

/**
 * Which node a {@code Check} notation evaluates its condition against.
 */
public final class CheckPos {

  public enum Kind {
    /** The node whose notation contains the check. */
    HERE,
    /** A child of that node, by index. Negative indices count from the end. */
    CHILD,
    /** Inside a fold's join: the child to the left of the join. */
    LEFT_CHILD,
    /** Inside a fold's join: the child to the right of the join. */
    RIGHT_CHILD
  }

  public static final CheckPos HERE = new CheckPos(Kind.HERE, 0);
  public static final CheckPos LEFT_CHILD = new CheckPos(Kind.LEFT_CHILD, 0);
  public static final CheckPos RIGHT_CHILD = new CheckPos(Kind.RIGHT_CHILD, 0);

  private final Kind kind;
  private final int index;

  private CheckPos(Kind kind, int index) {
    this.kind = kind;
    this.index = index;
  }

  public static CheckPos child(int index) {
    return new CheckPos(Kind.CHILD, index);
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Returns the child index. Only meaningful for {@link Kind#CHILD}.
   *
   * @return child index, possibly negative
   */
  public int index() {
    return index;
  }

  @Override
  public String toString() {
    switch (kind) {
      case HERE:
        return "Here";
      case CHILD:
        return "Child(" + index + ")";
      case LEFT_CHILD:
        return "LeftChild";
      default:
        return "RightChild";
    }
  }
}
