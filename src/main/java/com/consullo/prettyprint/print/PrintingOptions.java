package com.consullo.prettyprint.print;

import java.util.List;

/**
 * Options for a focused print.
 *
 * <p>
 * The path is a sequence of child indices leading from the document root to the node the print
 * is focused on. The focus target says where within that node the focus is.
 * </p>
 */
public final class PrintingOptions {

  private final int width;
  private final List<Integer> path;
  private final FocusTarget focusTarget;

  private PrintingOptions(Builder b) {
    this.width = b.width;
    this.path = b.path;
    this.focusTarget = b.focusTarget;
  }

  public int getWidth() {
    return width;
  }

  public List<Integer> getPath() {
    return path;
  }

  public FocusTarget getFocusTarget() {
    return focusTarget;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "PrintingOptions{width=" + width + ", path=" + path + ", focus=" + focusTarget + "}";
  }

  public static final class Builder {

    private int width = 80;
    private List<Integer> path = List.of();
    private FocusTarget focusTarget;

    private Builder() {
    }

    public Builder width(int width) {
      this.width = width;
      return this;
    }

    public Builder path(List<Integer> path) {
      this.path = path;
      return this;
    }

    public Builder focusTarget(FocusTarget focusTarget) {
      this.focusTarget = focusTarget;
      return this;
    }

    public PrintingOptions build() {
      if (width < 0) {
        throw new IllegalArgumentException("width must not be negative.");
      }
      if (path == null) {
        throw new IllegalArgumentException("path must not be null.");
      }
      for (Integer index : path) {
        if (index == null || index < 0) {
          throw new IllegalArgumentException("path indices must be non-negative: " + path);
        }
      }
      path = List.copyOf(path);
      if (focusTarget == null) {
        focusTarget = FocusTarget.start();
      }
      return new PrintingOptions(this);
    }
  }
}
