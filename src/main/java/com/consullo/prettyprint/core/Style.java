package com.consullo.prettyprint.core;

/**
 * Style value attached to printed text, such as a color or emphasis.
 *
 * <p>Styles nest: a node's style applies to everything inside it, and a style label applied
 * inside that node refines it further. How two styles merge is up to the style type. The usual
 * rule is that the inner style wins on identity attributes (color) and boolean attributes
 * (bold, underline) are OR-ed together.
 *
 * @param <S> the concrete style type
 * @since 1.0
 */
public interface Style<S extends Style<S>> {

  /**
   * Combines this (outer) style with a style applied inside of it.
   *
   * @param inner the style applied inside this one
   * @return the merged style
   */
  S combine(S inner);
}
