package com.consullo.prettyprint.print;

import com.consullo.prettyprint.consolidate.ConsolidatedNotation;
import com.consullo.prettyprint.consolidate.DelayedConsolidatedNotation;
import com.consullo.prettyprint.core.Style;

/**
 * A consolidated notation waiting to be resolved, with the id of the document node it came from.
 */
record Chunk<L, C, S extends Style<S>>(long id, ConsolidatedNotation<L, C, S> notation) {

  static <L, C, S extends Style<S>> Chunk<L, C, S> of(
      DelayedConsolidatedNotation<L, C, S> delayed) {
    long id = delayed.doc().id();
    return new Chunk<>(id, delayed.eval());
  }
}
