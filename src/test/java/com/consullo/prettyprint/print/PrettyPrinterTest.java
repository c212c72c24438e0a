package com.consullo.prettyprint.print;

import static com.consullo.prettyprint.notation.Notations.check;
import static com.consullo.prettyprint.notation.Notations.child;
import static com.consullo.prettyprint.notation.Notations.choice;
import static com.consullo.prettyprint.notation.Notations.concat;
import static com.consullo.prettyprint.notation.Notations.count;
import static com.consullo.prettyprint.notation.Notations.empty;
import static com.consullo.prettyprint.notation.Notations.eol;
import static com.consullo.prettyprint.notation.Notations.flat;
import static com.consullo.prettyprint.notation.Notations.fold;
import static com.consullo.prettyprint.notation.Notations.left;
import static com.consullo.prettyprint.notation.Notations.lit;
import static com.consullo.prettyprint.notation.Notations.mark;
import static com.consullo.prettyprint.notation.Notations.nl;
import static com.consullo.prettyprint.notation.Notations.right;
import static com.consullo.prettyprint.notation.Notations.text;
import static com.consullo.prettyprint.notation.Notations.vert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.consullo.prettyprint.core.PrettyDoc;
import com.consullo.prettyprint.core.PrintingException;
import com.consullo.prettyprint.core.Segment;
import com.consullo.prettyprint.examples.BasicStyle;
import com.consullo.prettyprint.examples.Color;
import com.consullo.prettyprint.examples.Json;
import com.consullo.prettyprint.examples.Tree;
import com.consullo.prettyprint.examples.TreeCondition;
import com.consullo.prettyprint.notation.CheckPos;
import com.consullo.prettyprint.notation.Notation;
import com.consullo.prettyprint.notation.NotationValidator;
import com.consullo.prettyprint.notation.ValidNotation;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for focused pretty printing.
 *
 * @since 1.0
 */
public class PrettyPrinterTest {

  private static ValidNotation<String, TreeCondition> valid(
      Notation<String, TreeCondition> notation) {
    return NotationValidator.validateOrThrow(notation);
  }

  private static Tree word(String s) {
    return Tree.text(valid(text()), s);
  }

  private static Tree leaf(Notation<String, TreeCondition> notation) {
    return Tree.branch(valid(notation), List.of());
  }

  private static List<String> lines(Tree doc, int width) {
    List<String> out = new ArrayList<>();
    for (Line<BasicStyle> line : PrettyPrinter.prettyPrintLines(doc, width)) {
      out.add(line.toString());
    }
    return out;
  }

  @Test
  @DisplayName("Should break after text that already overflows the width")
  void prettyPrint_TextWiderThanWidth_TakesNewlineOption() {
    Tree doc = leaf(concat(lit("Hello"), choice(empty(), nl())));

    assertThat(lines(doc, 1)).containsExactly("Hello", "");
    assertThat(lines(doc, 80)).containsExactly("Hello");
    PrettyPrintAssertions.assertPrintsConsistently(doc, 1);
  }

  @Test
  @DisplayName("Should join folded children with separators")
  void prettyPrint_Fold_JoinsChildren() {
    Tree doc = Tree.branch(
        valid(concat(lit("["), fold(child(0), concat(left(), lit(", "), right())), lit("]"))),
        word("a"), word("b"), word("c"));

    assertThat(PrettyPrinter.prettyPrintToString(doc, 80)).isEqualTo("[a, b, c]");
    PrettyPrintAssertions.assertPrintsConsistently(doc, 80);
  }

  @Test
  @DisplayName("Should keep a flattened notation on one line regardless of width")
  void prettyPrint_Flat_StaysOnOneLine() {
    Notation<String, TreeCondition> body = concat(lit("["),
        fold(child(0), concat(left(), choice(lit(", "), concat(lit(","), nl())), right())),
        lit("]"));
    Tree wrapping = Tree.branch(valid(body), word("a"), word("b"), word("c"));
    Tree flattened = Tree.branch(valid(flat(body)), word("a"), word("b"), word("c"));

    assertThat(lines(wrapping, 4)).containsExactly("[a,", "b,", "c]");
    assertThat(lines(flattened, 4)).containsExactly("[a, b, c]");
    PrettyPrintAssertions.assertPrintsConsistently(wrapping, 4);
    PrettyPrintAssertions.assertPrintsConsistently(flattened, 4);
  }

  @Test
  @DisplayName("Should resolve negative child indices from the end")
  void prettyPrint_NegativeChildIndex_CountsFromEnd() {
    Tree doc = Tree.branch(valid(concat(child(-1), lit("!"), child(0))), word("a"), word("b"));

    assertThat(PrettyPrinter.prettyPrintToString(doc, 80)).isEqualTo("b!a");
  }

  @Test
  @DisplayName("Should focus before a child in the middle of a wrapped list")
  void prettyPrint_SeekMiddleChild_SplitsAroundFocus() {
    Tree doc = Json.list(Json.number(1), Json.number(2), Json.number(3));

    PrettyPrintResult<BasicStyle> result = PrettyPrinter.prettyPrint(doc, 5, List.of(1), false);

    assertThat(result.focusedLine().leftString()).isEqualTo("    ");
    assertThat(result.focusedLine().rightString()).isEqualTo("2,");
    assertThat(PrettyPrintAssertions.drain(result.linesAbove())).containsExactly("    1,", "[");
    assertThat(PrettyPrintAssertions.drain(result.linesBelow())).containsExactly("    3", "]");
  }

  @Test
  @DisplayName("Should focus after a child when seeking its end")
  void prettyPrint_SeekEnd_FocusesAfterChild() {
    Tree doc = Json.list(Json.number(1), Json.number(2), Json.number(3));

    PrettyPrintResult<BasicStyle> result = PrettyPrinter.prettyPrint(doc, 5, List.of(1), true);

    assertThat(result.focusedLine().leftString()).isEqualTo("    2");
    assertThat(result.focusedLine().rightString()).isEqualTo(",");
  }

  @Test
  @DisplayName("Should focus at the end of the document when seeking the root's end")
  void prettyPrint_SeekRootEnd_FocusesOnLastLine() {
    Tree doc = Json.list(Json.number(1), Json.number(2), Json.number(3));

    PrettyPrintResult<BasicStyle> result = PrettyPrinter.prettyPrint(doc, 5, List.of(), true);

    assertThat(result.focusedLine().leftString()).isEqualTo("]");
    assertThat(result.focusedLine().rightString()).isEmpty();
    assertThat(result.linesBelow().hasNext()).isFalse();
    assertThat(PrettyPrintAssertions.drain(result.linesAbove()))
        .containsExactly("    3", "    2,", "    1,", "[");
  }

  @Test
  @DisplayName("Should focus inside a node's text")
  void prettyPrint_TextTarget_SplitsText() {
    Tree doc = Json.list(Json.string("hello"));

    PrettyPrintResult<BasicStyle> inside = PrettyPrinter.prettyPrint(doc,
        PrintingOptions.builder().width(80).path(List.of(0)).focusTarget(FocusTarget.text(2))
            .build());
    PrettyPrintResult<BasicStyle> pastEnd = PrettyPrinter.prettyPrint(doc,
        PrintingOptions.builder().width(80).path(List.of(0)).focusTarget(FocusTarget.text(99))
            .build());

    assertThat(inside.focusedLine().leftString()).isEqualTo("[\"he");
    assertThat(inside.focusedLine().rightString()).isEqualTo("llo\"]");
    assertThat(pastEnd.focusedLine().leftString()).isEqualTo("[\"hello");
    assertThat(pastEnd.focusedLine().rightString()).isEqualTo("\"]");
  }

  @Test
  @DisplayName("Should focus at a focus mark, even on a later line of the node")
  void prettyPrint_MarkTarget_FocusesAtMark() {
    Tree sameLine = leaf(concat(lit("ab"), mark(), lit("cd")));
    Tree laterLine = leaf(vert(lit("one"), concat(lit("tw"), mark(), lit("o"))));
    PrintingOptions options = PrintingOptions.builder().focusTarget(FocusTarget.mark()).build();

    PrettyPrintResult<BasicStyle> first = PrettyPrinter.prettyPrint(sameLine, options);
    PrettyPrintResult<BasicStyle> second = PrettyPrinter.prettyPrint(laterLine, options);

    assertThat(first.focusedLine().leftString()).isEqualTo("ab");
    assertThat(first.focusedLine().rightString()).isEqualTo("cd");
    assertThat(second.focusedLine().leftString()).isEqualTo("tw");
    assertThat(second.focusedLine().rightString()).isEqualTo("o");
    assertThat(PrettyPrintAssertions.drain(second.linesAbove())).containsExactly("one");
  }

  @Test
  @DisplayName("Should fail when the focus mark or text is missing")
  void prettyPrint_MissingTarget_Throws() {
    PrintingOptions markOptions =
        PrintingOptions.builder().focusTarget(FocusTarget.mark()).build();
    PrintingOptions textOptions =
        PrintingOptions.builder().focusTarget(FocusTarget.text(0)).build();

    assertThatThrownBy(() -> PrettyPrinter.prettyPrint(leaf(lit("abcd")), markOptions))
        .isInstanceOfSatisfying(PrintingException.class, e -> assertThat(e.reason())
            .isEqualTo(PrintingException.Reason.MISSING_FOCUS_MARK));
    assertThatThrownBy(() -> PrettyPrinter.prettyPrint(Json.nil(), textOptions))
        .isInstanceOfSatisfying(PrintingException.class, e -> assertThat(e.reason())
            .isEqualTo(PrintingException.Reason.MISSING_TEXT));
  }

  @Test
  @DisplayName("Should find a child's focus mark on a later line of the child")
  void prettyPrint_MarkOnLaterLineOfChild_FocusesAtMark() {
    Tree doc = Tree.branch(valid(concat(child(0), nl(), lit("after"))),
        leaf(vert(lit("one"), concat(lit("tw"), mark(), lit("o")))));

    PrettyPrintResult<BasicStyle> result = PrettyPrinter.prettyPrint(doc,
        PrintingOptions.builder().path(List.of(0)).focusTarget(FocusTarget.mark()).build());

    assertThat(result.focusedLine().leftString()).isEqualTo("tw");
    assertThat(result.focusedLine().rightString()).isEqualTo("o");
    assertThat(PrettyPrintAssertions.drain(result.linesAbove())).containsExactly("one");
    assertThat(PrettyPrintAssertions.drain(result.linesBelow())).containsExactly("after");
  }

  @Test
  @DisplayName("Should give up on a missing mark once the node is printed, however long the rest is")
  void prettyPrint_MissingMark_WorkIndependentOfDocumentSize() {
    int smallWork = workToMissMark(10);
    int bigWork = workToMissMark(40);

    assertThat(bigWork).isEqualTo(smallWork);
  }

  private static int workToMissMark(int depth) {
    Tree doc = Json.list(Json.list(Json.number(1), Json.number(2)), nested(depth));
    AtomicInteger calls = new AtomicInteger();
    PrintingOptions options = PrintingOptions.builder().width(20).path(List.of(0))
        .focusTarget(FocusTarget.mark()).build();

    assertThatThrownBy(() -> PrettyPrinter.prettyPrint(new CountingDoc(doc, calls), options))
        .isInstanceOfSatisfying(PrintingException.class, e -> assertThat(e.reason())
            .isEqualTo(PrintingException.Reason.MISSING_FOCUS_MARK));
    return calls.get();
  }

  @Test
  @DisplayName("Should reject a path that leads nowhere")
  void prettyPrint_InvalidPath_Throws() {
    Tree doc = Json.list(Json.number(1), Json.number(2), Json.number(3));

    assertThatThrownBy(() -> PrettyPrinter.prettyPrint(doc, 80, List.of(5), false))
        .isInstanceOfSatisfying(PrintingException.class, e -> {
          assertThat(e.reason()).isEqualTo(PrintingException.Reason.INVALID_PATH);
          assertThat(e.index()).isEqualTo(5);
        });
    assertThatThrownBy(() -> PrettyPrinter.prettyPrint(doc, 80, List.of(0, 0), false))
        .isInstanceOfSatisfying(PrintingException.class,
            e -> assertThat(e.reason()).isEqualTo(PrintingException.Reason.INVALID_PATH));
  }

  @Test
  @DisplayName("Should report a child index past the node's children")
  void prettyPrint_ChildIndexOutOfBounds_Throws() {
    Tree doc = Tree.branch(valid(concat(child(0), child(3))), word("a"));

    assertThatThrownBy(() -> PrettyPrinter.prettyPrintToString(doc, 80))
        .isInstanceOfSatisfying(PrintingException.class, e -> {
          assertThat(e.reason()).isEqualTo(PrintingException.Reason.CHILD_INDEX_OUT_OF_BOUNDS);
          assertThat(e.index()).isEqualTo(3);
          assertThat(e.length()).isEqualTo(1);
        });
  }

  @Test
  @DisplayName("Should report a text notation on a node with children")
  void prettyPrint_TextOnChildfulNode_Throws() {
    Tree doc = Tree.branch(valid(text()), word("a"));

    assertThatThrownBy(() -> PrettyPrinter.prettyPrintToString(doc, 80))
        .isInstanceOfSatisfying(PrintingException.class, e -> assertThat(e.reason())
            .isEqualTo(PrintingException.Reason.TEXT_NOTATION_ON_CHILDFUL_DOC));
  }

  @Test
  @DisplayName("Should report text printed after an end of line from another node")
  void prettyPrint_TextAfterChildEndOfLine_Throws() {
    Tree lineComment = leaf(concat(lit("// c"), eol()));
    Tree broken = Tree.branch(valid(concat(child(0), lit("x"))), lineComment);
    Tree fine = Tree.branch(valid(concat(child(0), nl(), lit("x"))),
        leaf(concat(lit("// c"), eol())));

    assertThatThrownBy(() -> PrettyPrinter.prettyPrintToString(broken, 80))
        .isInstanceOfSatisfying(PrintingException.class, e -> assertThat(e.reason())
            .isEqualTo(PrintingException.Reason.TEXT_AFTER_END_OF_LINE));
    assertThat(lines(fine, 80)).containsExactly("// c", "x");
  }

  @Test
  @DisplayName("Should skip the option that would put text after an end of line")
  void prettyPrint_EndOfLineInPreferredOption_TakesFallback() {
    Tree doc = Tree.branch(
        valid(concat(child(0), choice(lit(" x"), concat(nl(), lit("x"))))),
        leaf(concat(lit("// c"), eol())));

    assertThat(lines(doc, 80)).containsExactly("// c", "x");
    PrettyPrintAssertions.assertPrintsConsistently(doc, 80);
  }

  @Test
  @DisplayName("Should allow empty text after an end of line")
  void prettyPrint_EmptyTextAfterEndOfLine_Printed() {
    Tree doc = Tree.branch(valid(concat(child(0), child(1))),
        leaf(concat(lit("// c"), eol())), word(""));

    assertThat(lines(doc, 80)).containsExactly("// c");
    PrettyPrintAssertions.assertPrintsConsistently(doc, 80);
  }

  @Test
  @DisplayName("Should lay out separators from the conditions of the children on either side")
  void prettyPrint_SeparatorChecks_DependOnNeighbors() {
    Notation<String, TreeCondition> separated = concat(lit("["),
        fold(child(0), concat(left(),
            check(TreeCondition.NEEDS_SEPARATOR, CheckPos.LEFT_CHILD, lit(","), empty()),
            check(TreeCondition.IS_COMMENT, CheckPos.RIGHT_CHILD, lit("  "),
                choice(lit(" "), nl())),
            right())),
        lit("]"));
    Tree doc = Tree.branch(valid(separated), word("a"), word("b"), word("// c").asComment());

    assertThat(lines(doc, 80)).containsExactly("[a, b  // c]");
    assertThat(lines(doc, 4)).containsExactly("[a,", "b  // c]");

    PrettyPrintResult<BasicStyle> atB = PrettyPrinter.prettyPrint(doc, 4, List.of(1), false);
    assertThat(atB.focusedLine().leftString()).isEmpty();
    assertThat(atB.focusedLine().rightString()).isEqualTo("b  // c]");
    assertThat(PrettyPrintAssertions.drain(atB.linesAbove())).containsExactly("[a,");
    assertThat(PrettyPrintAssertions.drain(atB.linesBelow())).isEmpty();

    PrettyPrintResult<BasicStyle> afterComment =
        PrettyPrinter.prettyPrint(doc, 80, List.of(2), true);
    assertThat(afterComment.focusedLine().leftString()).isEqualTo("[a, b  // c");
    assertThat(afterComment.focusedLine().rightString()).isEqualTo("]");

    for (int width : new int[] {4, 11, 12, 80}) {
      PrettyPrintAssertions.assertPrintsConsistently(doc, width);
    }
  }

  @Test
  @DisplayName("Should print what a node checks about its child when focused on that child")
  void prettyPrint_ChildCheck_SeenFromChild() {
    Notation<String, TreeCondition> notation = concat(lit("("), child(0),
        check(TreeCondition.IS_EMPTY_TEXT, CheckPos.child(0), lit("none"), empty()), lit(")"));
    Tree emptyChild = Tree.branch(valid(notation), word(""));
    Tree fullChild = Tree.branch(valid(notation), word("v"));

    PrettyPrintResult<BasicStyle> result =
        PrettyPrinter.prettyPrint(emptyChild, 80, List.of(0), false);

    assertThat(result.focusedLine().leftString()).isEqualTo("(");
    assertThat(result.focusedLine().rightString()).isEqualTo("none)");
    assertThat(lines(fullChild, 80)).containsExactly("(v)");
    PrettyPrintAssertions.assertPrintsConsistently(emptyChild, 80);
    PrettyPrintAssertions.assertPrintsConsistently(fullChild, 80);
  }

  @Test
  @SuppressWarnings("unchecked")
  @DisplayName("Should report a node whose child count changes during a print")
  void prettyPrint_NumChildrenChanges_Throws() {
    PrettyDoc<String, TreeCondition, BasicStyle> doc = mock(PrettyDoc.class);
    when(doc.id()).thenReturn(7L);
    when(doc.nodeStyle()).thenReturn(BasicStyle.PLAIN);
    when(doc.notation()).thenReturn(valid(
        count(empty(), child(0), fold(child(0), concat(left(), lit(","), right())))));
    when(doc.numChildren()).thenReturn(OptionalInt.of(3), OptionalInt.of(1));

    assertThatThrownBy(() -> PrettyPrinter.prettyPrintToString(doc, 80))
        .isInstanceOfSatisfying(PrintingException.class, e -> assertThat(e.reason())
            .isEqualTo(PrintingException.Reason.NUM_CHILDREN_CHANGED));
  }

  @Test
  @SuppressWarnings("unchecked")
  @DisplayName("Should pass a document's own exception through unchanged")
  void prettyPrint_DocumentThrows_PropagatesException() {
    PrettyDoc<String, TreeCondition, BasicStyle> doc = mock(PrettyDoc.class);
    when(doc.id()).thenReturn(1L);
    when(doc.nodeStyle()).thenReturn(BasicStyle.PLAIN);
    when(doc.notation()).thenReturn(valid(text()));
    when(doc.numChildren()).thenReturn(OptionalInt.empty());
    when(doc.unwrapText()).thenThrow(new IllegalStateException("storage offline"));

    assertThatThrownBy(() -> PrettyPrinter.prettyPrintToString(doc, 80))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("storage offline");
  }

  @Test
  @DisplayName("Should carry node and notation styles into segments")
  void prettyPrintLines_Styles_AppliedToSegments() {
    Tree doc = Json.list(Json.number(5))
        .withStyle(BasicStyle.PLAIN.withBold())
        .withStyleOverride("open", BasicStyle.PLAIN.withColor(Color.RED));

    List<Line<BasicStyle>> lines = PrettyPrinter.prettyPrintLines(doc, 80);

    assertThat(lines).hasSize(1);
    List<Segment<BasicStyle>> segments = lines.get(0).segments();
    assertThat(segments).extracting(Segment::str).containsExactly("[", "5", "]");
    assertThat(segments.get(0).style()).isEqualTo(new BasicStyle(Color.RED, true));
    assertThat(segments.get(1).style()).isEqualTo(new BasicStyle(Color.BLUE, true));
    assertThat(segments.get(2).style()).isEqualTo(new BasicStyle(Color.WHITE, true));
  }

  @Test
  @DisplayName("Should print each direction independently of the other")
  void prettyPrint_Iterators_AreIndependent() {
    Tree doc = Json.list(Json.number(1), Json.number(2), Json.number(3), Json.number(4));

    PrettyPrintResult<BasicStyle> first = PrettyPrinter.prettyPrint(doc, 5, List.of(2), false);
    List<String> below = PrettyPrintAssertions.drain(first.linesBelow());
    List<String> above = PrettyPrintAssertions.drain(first.linesAbove());
    PrettyPrintResult<BasicStyle> second = PrettyPrinter.prettyPrint(doc, 5, List.of(2), false);

    assertThat(above).isEqualTo(PrettyPrintAssertions.drain(second.linesAbove()));
    assertThat(below).isEqualTo(PrettyPrintAssertions.drain(second.linesBelow()));
  }

  @Test
  @DisplayName("Should do the same work near the focus no matter how big the rest of the document is")
  void prettyPrint_LinesNearFocus_WorkIndependentOfDocumentSize() {
    int smallWork = workForThreeLines(10);
    int bigWork = workForThreeLines(40);

    assertThat(bigWork).isEqualTo(smallWork);
  }

  private static int workForThreeLines(int depth) {
    Tree doc = Json.list(nested(depth), Json.list(Json.number(1), Json.number(2)),
        nested(depth));
    AtomicInteger calls = new AtomicInteger();

    PrettyPrintResult<BasicStyle> result =
        PrettyPrinter.prettyPrint(new CountingDoc(doc, calls), 20, List.of(1), false);
    assertThat(result.focusedLine().toString()).isEqualTo("    [1, 2],");
    assertThat(result.linesAbove().next().toString()).isEqualTo("    ],");
    assertThat(result.linesBelow().next().toString()).isEqualTo("    [");
    return calls.get();
  }

  private static Tree nested(int depth) {
    if (depth == 0) {
      return Json.number(0);
    }
    return Json.list(Json.number(1), nested(depth - 1), Json.number(1));
  }

  @Test
  @DisplayName("Should agree with the whole-document printer on every focus")
  void prettyPrint_JsonDocuments_MatchOracle() {
    Tree doc = Json.list(
        Json.number(1),
        Json.list(Json.string("x"), Json.bool(true), Json.nil()),
        Json.list(),
        Json.comment("pretty printing one line at a time", Json.number(2.5)));

    for (int width : new int[] {1, 8, 20, 40, 80}) {
      PrettyPrintAssertions.assertPrintsConsistently(doc, width);
    }
  }

  /**
   * Counts the calls the printer makes into a document.
   */
  private static final class CountingDoc implements PrettyDoc<String, TreeCondition, BasicStyle> {

    private final Tree tree;
    private final AtomicInteger calls;

    CountingDoc(Tree tree, AtomicInteger calls) {
      this.tree = tree;
      this.calls = calls;
    }

    @Override
    public long id() {
      return tree.id();
    }

    @Override
    public ValidNotation<String, TreeCondition> notation() {
      return tree.notation();
    }

    @Override
    public OptionalInt numChildren() {
      calls.incrementAndGet();
      return tree.numChildren();
    }

    @Override
    public String unwrapText() {
      calls.incrementAndGet();
      return tree.unwrapText();
    }

    @Override
    public PrettyDoc<String, TreeCondition, BasicStyle> unwrapChild(int index) {
      calls.incrementAndGet();
      return new CountingDoc(tree.unwrapChild(index), calls);
    }

    @Override
    public BasicStyle nodeStyle() {
      return tree.nodeStyle();
    }

    @Override
    public BasicStyle lookupStyle(String label) {
      return tree.lookupStyle(label);
    }

    @Override
    public boolean condition(TreeCondition condition) {
      return tree.condition(condition);
    }
  }
}
