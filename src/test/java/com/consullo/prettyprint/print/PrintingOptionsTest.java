package com.consullo.prettyprint.print;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the printing options builder.
 *
 * @since 1.0
 */
public class PrintingOptionsTest {

  @Test
  @DisplayName("Should default to width 80 focused at the start of the root")
  void build_Defaults_StartOfRoot() {
    PrintingOptions options = PrintingOptions.builder().build();

    assertThat(options.getWidth()).isEqualTo(80);
    assertThat(options.getPath()).isEmpty();
    assertThat(options.getFocusTarget().kind()).isEqualTo(FocusTarget.Kind.START);
  }

  @Test
  @DisplayName("Should copy the path so later changes do not leak in")
  void build_MutablePath_Copied() {
    List<Integer> path = new ArrayList<>(List.of(1, 2));
    PrintingOptions options = PrintingOptions.builder().path(path).build();

    path.add(3);

    assertThat(options.getPath()).containsExactly(1, 2);
  }

  @Test
  @DisplayName("Should reject a negative width or path index")
  void build_InvalidValues_Throws() {
    assertThatThrownBy(() -> PrintingOptions.builder().width(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PrintingOptions.builder().path(List.of(0, -2)).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PrintingOptions.builder().path(null).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should reject a negative text index")
  void text_NegativeIndex_Throws() {
    assertThatThrownBy(() -> FocusTarget.text(-1)).isInstanceOf(IllegalArgumentException.class);
  }
}
