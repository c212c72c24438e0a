package com.consullo.prettyprint.print;

import java.util.Iterator;

/**
 * The outcome of a focused print.
 *
 * <p>
 * The iterators compute lines only as they are advanced, and do not affect each other. Either one
 * may throw {@link com.consullo.prettyprint.core.PrintingException} from {@code next()}, or any
 * exception thrown by the document; after that it must not be used again.
 * </p>
 *
 * @param linesAbove lines above the focused line, nearest first
 * @param focusedLine the line containing the focus
 * @param linesBelow lines below the focused line, nearest first
 * @param <S> style type
 * @since 1.0
 */
public record PrettyPrintResult<S>(Iterator<Line<S>> linesAbove, FocusedLine<S> focusedLine,
    Iterator<Line<S>> linesBelow) {
}
