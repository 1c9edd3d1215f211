package im.arun.promptelide.tree;

import im.arun.promptelide.language.IndentationParser;
import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.model.LineNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static im.arun.promptelide.model.IndentationNode.blank;
import static im.arun.promptelide.model.IndentationNode.line;
import static im.arun.promptelide.model.IndentationNode.top;
import static im.arun.promptelide.model.IndentationNode.virtual;
import static im.arun.promptelide.tree.TreeAssertions.assertSameTree;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StructureCorrector Tests")
class StructureCorrectorTest {

    private static final String OPENER = StructureCorrector.OPENER;
    private static final String CLOSER = StructureCorrector.CLOSER;

    private static IndentationNode<String> parseWithOwnLineBraces(String source) {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put(OPENER, Pattern.compile("^\\{$"));
        patterns.put(CLOSER, Pattern.compile("^}$"));
        IndentationNode<String> tree = RawParser.parseRaw(source);
        LineLabeler.labelLines(tree, LineLabeler.buildLabelRules(patterns));
        return StructureCorrector.flattenVirtual(StructureCorrector.combineClosersAndOpeners(tree));
    }

    private static String childSummary(IndentationNode<String> node) {
        return node.getChildren().stream()
                .map(child -> child.isLine() ? ((LineNode<String>) child).getSourceLine() : "v")
                .collect(Collectors.joining(","));
    }

    @Nested
    @DisplayName("combineClosersAndOpeners")
    class CombineClosersAndOpeners {

        @Test
        @DisplayName("Should move closing brackets under the block they close")
        void shouldCombineBraces() {
            String source = String.join("\n",
                    "A {",
                    "}",
                    "B",
                    "  b1 {",
                    "    bb1",
                    "  }",
                    "  b2 {",
                    "    bb2",
                    "",
                    "  }",
                    "}",
                    "C {",
                    "    c1",
                    "    c2",
                    "  c3",
                    "  c4",
                    "}");

            IndentationNode<String> tree = IndentationParser.parseTree(source);

            IndentationNode<String> expected = top(
                    line(0, 0, "A {", List.of(line(0, 1, "}", List.of(), CLOSER))),
                    line(0, 2, "B", List.of(
                            line(2, 3, "b1 {", List.of(
                                    line(4, 4, "bb1", List.of()),
                                    line(2, 5, "}", List.of(), CLOSER))),
                            line(2, 6, "b2 {", List.of(
                                    line(4, 7, "bb2", List.of()),
                                    blank(8),
                                    line(2, 9, "}", List.of(), CLOSER))),
                            line(0, 10, "}", List.of(), CLOSER))),
                    line(0, 11, "C {", List.of(
                            line(4, 12, "c1", List.of()),
                            line(4, 13, "c2", List.of()),
                            line(2, 14, "c3", List.of()),
                            line(2, 15, "c4", List.of()),
                            line(0, 16, "}", List.of(), CLOSER))));
            assertSameTree(tree, expected);
        }

        @Test
        @DisplayName("Should give the same tree when run twice")
        void shouldBeIdempotent() {
            String source = String.join("\n",
                    "if (condition) {",
                    "    print(\"hello\")",
                    "    print(\"world\")",
                    "} else {",
                    "    print(\"goodbye\")",
                    "}",
                    "B",
                    "  b1 {",
                    "    bb1",
                    "",
                    "  }");
            IndentationNode<String> tree = IndentationParser.parseTree(source);
            IndentationNode<String> expected = TreeUtils.duplicateTree(tree);

            assertSameTree(StructureCorrector.combineClosersAndOpeners(tree), expected);
        }

        @Test
        @DisplayName("Should not move an opener under a deeper continuation line")
        void shouldKeepOpenerOutOfContinuationLine() {
            String source = String.join("\n",
                    "void f(int a,",
                    "       int b)",
                    "{",
                    "  body();",
                    "}");
            IndentationNode<String> tree = IndentationParser.parseTree(source);

            assertSameTree(tree, top(
                    line(0, 0, "void f(int a,", List.of(
                            line(7, 1, "int b)", List.of()),
                            line(0, 2, "{", List.of(), OPENER),
                            line(2, 3, "body();", List.of()),
                            line(0, 4, "}", List.of(), CLOSER)))));

            IndentationNode<String> expected = TreeUtils.duplicateTree(tree);
            assertSameTree(StructureCorrector.combineClosersAndOpeners(tree), expected);
        }

        @Test
        @DisplayName("Should merge an opener into its older sibling")
        void shouldMergeOpenerIntoOlderSibling() {
            String source = "A\n(\n    B\n    C";

            assertSameTree(RawParser.parseRaw(source), top(
                    line(0, 0, "A", List.of()),
                    line(0, 1, "(", List.of(line(4, 2, "B", List.of()), line(4, 3, "C", List.of())))));
            assertSameTree(IndentationParser.parseTree(source), top(
                    line(0, 0, "A", List.of(
                            line(0, 1, "(", List.of(), OPENER),
                            line(4, 2, "B", List.of()),
                            line(4, 3, "C", List.of())))));
        }

        @Test
        @DisplayName("Should move a closer under the preceding block")
        void shouldMergeSimpleCloser() {
            String source = "A\n    B\n)";

            assertSameTree(IndentationParser.parseTree(source), top(
                    line(0, 0, "A", List.of(line(4, 1, "B", List.of()), line(0, 2, ")", List.of(), CLOSER)))));
        }

        @Test
        @DisplayName("Should wrap the first body in a virtual node when a closer opens another body")
        void shouldWrapBodiesOfMultiBodyConstruct() {
            String source = "A\n    B\n    C\n) + (\n    D\n    E\n)";

            assertThat(childSummary(RawParser.parseRaw(source).getChildren().get(0))).isEqualTo("B,C");
            assertThat(childSummary(IndentationParser.parseTree(source).getChildren().get(0)))
                    .isEqualTo("v,) + (,)");
        }

        @Test
        @DisplayName("Should parse K&R if-else into one construct")
        void shouldParseKernighanRitchieIfElse() {
            String source = String.join("\n",
                    "if (condition) {",
                    "    print(\"hello\")",
                    "    print(\"world\")",
                    "} else {",
                    "    print(\"goodbye\")",
                    "    print(\"phone\")",
                    "}");

            IndentationNode<String> expected = top(
                    line(0, 0, "if (condition) {", List.of(
                            virtual(0, List.of(
                                    line(4, 1, "print(\"hello\")", List.of()),
                                    line(4, 2, "print(\"world\")", List.of()))),
                            line(0, 3, "} else {", List.of(
                                    line(4, 4, "print(\"goodbye\")", List.of()),
                                    line(4, 5, "print(\"phone\")", List.of())), CLOSER),
                            line(0, 6, "}", List.of(), CLOSER))));
            assertSameTree(IndentationParser.parseTree(source), expected);
        }

        @Test
        @DisplayName("Should attach Allman-style braces to the function header")
        void shouldParseAllmanFunction() {
            String source = String.join("\n",
                    "function test()",
                    "{",
                    "    print(\"hello\")",
                    "    print(\"world\")",
                    "}");

            assertSameTree(RawParser.parseRaw(source), top(
                    line(0, 0, "function test()", List.of()),
                    line(0, 1, "{", List.of(
                            line(4, 2, "print(\"hello\")", List.of()),
                            line(4, 3, "print(\"world\")", List.of()))),
                    line(0, 4, "}", List.of())));
            assertSameTree(IndentationParser.parseTree(source), top(
                    line(0, 0, "function test()", List.of(
                            line(0, 1, "{", List.of(), OPENER),
                            line(4, 2, "print(\"hello\")", List.of()),
                            line(4, 3, "print(\"world\")", List.of()),
                            line(0, 4, "}", List.of(), CLOSER)))));
        }

        @Test
        @DisplayName("Should parse Allman if-else as two consecutive blocks")
        void shouldParseAllmanIfElse() {
            String source = String.join("\n",
                    "if (condition)",
                    "{",
                    "    print(\"hello\")",
                    "    print(\"world\")",
                    "}",
                    "else",
                    "{",
                    "    print(\"goodbye\")",
                    "    print(\"phone\")",
                    "}");

            assertSameTree(IndentationParser.parseTree(source), top(
                    line(0, 0, "if (condition)", List.of(
                            line(0, 1, "{", List.of(), OPENER),
                            line(4, 2, "print(\"hello\")", List.of()),
                            line(4, 3, "print(\"world\")", List.of()),
                            line(0, 4, "}", List.of(), CLOSER))),
                    line(0, 5, "else", List.of(
                            line(0, 6, "{", List.of(), OPENER),
                            line(4, 7, "print(\"goodbye\")", List.of()),
                            line(4, 8, "print(\"phone\")", List.of()),
                            line(0, 9, "}", List.of(), CLOSER)))));
        }

        @Test
        @DisplayName("Should keep GNU-style indented braces around their body")
        void shouldHandleIndentedGnuBraces() {
            IndentationNode<String> tree = parseWithOwnLineBraces("A\n  {\n    stmt\n  }");

            assertSameTree(tree, top(
                    line(0, 0, "A", List.of(
                            line(2, 1, "{", List.of(
                                    line(4, 2, "stmt", List.of()),
                                    line(2, 3, "}", List.of(), CLOSER)), OPENER)))));
        }

        @Test
        @DisplayName("Should carry blank lines before a closer into the block")
        void shouldMoveBlanksBeforeCloser() {
            IndentationNode<String> tree = parseWithOwnLineBraces("B\n{\n    stmt\n\n}\n\n\nend");

            assertSameTree(tree, top(
                    line(0, 0, "B", List.of(
                            line(0, 1, "{", List.of(), OPENER),
                            line(4, 2, "stmt", List.of()),
                            blank(3),
                            line(0, 4, "}", List.of(), CLOSER))),
                    blank(5),
                    blank(6),
                    line(0, 7, "end", List.of())));
        }

        @Test
        @DisplayName("Should handle a block holding only a blank line")
        void shouldHandleEmptyBlock() {
            IndentationNode<String> tree = parseWithOwnLineBraces("C\n{\n\n}");

            assertSameTree(tree, top(
                    line(0, 0, "C", List.of(
                            line(0, 1, "{", List.of(), OPENER),
                            blank(2),
                            line(0, 3, "}", List.of(), CLOSER)))));
        }

        @Test
        @DisplayName("Should handle nested blocks with braces on their own lines")
        void shouldHandleNestedGnuBlocks() {
            String source = String.join("\n",
                    "D",
                    "{",
                    "    d",
                    "    {",
                    "        stmt",
                    "",
                    "    }",
                    "}");

            assertSameTree(parseWithOwnLineBraces(source), top(
                    line(0, 0, "D", List.of(
                            line(0, 1, "{", List.of(), OPENER),
                            line(4, 2, "d", List.of(
                                    line(4, 3, "{", List.of(), OPENER),
                                    line(8, 4, "stmt", List.of()),
                                    blank(5),
                                    line(4, 6, "}", List.of(), CLOSER))),
                            line(0, 7, "}", List.of(), CLOSER)))));
        }
    }

    @Nested
    @DisplayName("groupBlocks")
    class GroupBlocks {

        private List<Object> summary(IndentationNode<String> node) {
            return node.getChildren().stream()
                    .map(child -> child.isVirtual() ? (Object) "v" : (Object) child.getLineNumber())
                    .collect(Collectors.toList());
        }

        @Test
        @DisplayName("Should group paragraphs separated by blank lines")
        void shouldGroupParagraphs() {
            String source = "A\n\nB\nC\nD\n\nE\nF\n\nG\nH";

            IndentationNode<String> tree = StructureCorrector.groupBlocks(RawParser.parseRaw(source));

            assertThat(summary(tree)).containsExactly("v", "v", "v", "v");
            assertThat(summary(tree.getChildren().get(0))).containsExactly(0, 1);
            assertThat(summary(tree.getChildren().get(1))).containsExactly(2, 3, 4, 5);
            assertThat(summary(tree.getChildren().get(2))).containsExactly(6, 7, 8);
            assertThat(summary(tree.getChildren().get(3))).containsExactly(9, 10);
        }

        @Test
        @DisplayName("Should group at every level and take the smallest member indentation")
        void shouldGroupNestedBlocks() {
            String source = String.join("\n",
                    "A",
                    "",
                    "  B",
                    "  C",
                    "    D",
                    "",
                    "  E",
                    "",
                    "",
                    "  F",
                    "",
                    "G",
                    "    H",
                    "    I",
                    "  J",
                    "",
                    "  K");

            IndentationNode<String> tree = StructureCorrector.groupBlocks(RawParser.parseRaw(source));

            IndentationNode<String> expected = top(
                    virtual(0, List.of(
                            line(0, 0, "A", List.of(
                                    blank(1),
                                    virtual(2, List.of(
                                            line(2, 2, "B", List.of()),
                                            line(2, 3, "C", List.of(line(4, 4, "D", List.of()))),
                                            blank(5))),
                                    virtual(2, List.of(line(2, 6, "E", List.of()), blank(7), blank(8))),
                                    virtual(2, List.of(line(2, 9, "F", List.of()))))),
                            blank(10))),
                    virtual(0, List.of(
                            line(0, 11, "G", List.of(
                                    virtual(2, List.of(
                                            line(4, 12, "H", List.of()),
                                            line(4, 13, "I", List.of()),
                                            line(2, 14, "J", List.of()),
                                            blank(15))),
                                    virtual(2, List.of(line(2, 16, "K", List.of()))))))));
            assertSameTree(tree, expected);
        }

        @Test
        @DisplayName("Should leave leading blank children ungrouped")
        void shouldNotGroupLeadingBlanks() {
            String source = "A\n\n\n    B1\n    B2\nC";

            IndentationNode<String> tree = StructureCorrector.groupBlocks(RawParser.parseRaw(source));

            assertSameTree(tree, top(
                    line(0, 0, "A", List.of(
                            blank(1),
                            blank(2),
                            virtual(4, List.of(line(4, 3, "B1", List.of()), line(4, 4, "B2", List.of()))))),
                    line(0, 5, "C", List.of())));
        }

        @Test
        @DisplayName("Should only delimit by direct children")
        void shouldGroupChildrenEndingWithBlank() {
            IndentationNode<String> base = top(
                    line(0, 0, "A", List.of(blank(1))),
                    line(0, 2, "B", List.of(blank(3), blank(4))),
                    blank(5),
                    line(0, 6, "C", List.of()));

            IndentationNode<String> tree = StructureCorrector.groupBlocks(base);

            assertSameTree(tree, top(
                    virtual(0, List.of(
                            line(0, 0, "A", List.of(blank(1))),
                            line(0, 2, "B", List.of(blank(3), blank(4))),
                            blank(5))),
                    virtual(0, List.of(line(0, 6, "C", List.of())))));
        }

        @Test
        @DisplayName("Should group by a custom delimiter and label the groups")
        void shouldGroupWithCustomDelimiter() {
            IndentationNode<String> tree = RawParser.parseRaw("A\nB\nC\nD\nE");

            tree = StructureCorrector.groupBlocks(tree, node -> node.isLine()
                    && List.of("B", "D").contains(((LineNode<String>) node).getSourceLine()), "group");

            assertSameTree(tree, top(
                    virtual(0, List.of(line(0, 0, "A", List.of()), line(0, 1, "B", List.of())), "group"),
                    virtual(0, List.of(line(0, 2, "C", List.of()), line(0, 3, "D", List.of())), "group"),
                    virtual(0, List.of(line(0, 4, "E", List.of())), "group")));
        }

        @Test
        @DisplayName("Should not wrap a single block spanning all children")
        void shouldNotWrapSingleBlock() {
            IndentationNode<String> tree = StructureCorrector.groupBlocks(RawParser.parseRaw("A\nB\nC"));

            assertThat(tree.getChildren()).hasSize(3).allMatch(IndentationNode::isLine);
        }
    }

    @Nested
    @DisplayName("flattenVirtual")
    class FlattenVirtual {

        @Test
        @DisplayName("Should drop empty virtual nodes and unwrap single children")
        void shouldRemoveEmptyAndSingleChildVirtualNodes() {
            IndentationNode<String> before = top(
                    virtual(0, List.of()),
                    virtual(0, List.of(line(0, 0, "lonely node", List.of()))));

            assertSameTree(StructureCorrector.flattenVirtual(before), top(line(0, 0, "lonely node", List.of())));
        }

        @Test
        @DisplayName("Should splice an only virtual child into its parent")
        void shouldUnwrapNestedVirtualNode() {
            IndentationNode<String> before = top(
                    line(0, 0, "A", List.of(virtual(2, List.of(line(2, 1, "lonely node", List.of()))))));

            assertSameTree(StructureCorrector.flattenVirtual(before),
                    top(line(0, 0, "A", List.of(line(2, 1, "lonely node", List.of())))));
        }

        @Test
        @DisplayName("Should give the same tree when flattened twice")
        void shouldReachFixedPoint() {
            IndentationNode<String> grouped = StructureCorrector.groupBlocks(
                    IndentationParser.parseTree("a\n\nb\n  c\n\n  d\ne", "markdown"));
            IndentationNode<String> once = StructureCorrector.flattenVirtual(grouped);
            IndentationNode<String> expected = TreeUtils.duplicateTree(once);

            assertSameTree(StructureCorrector.flattenVirtual(once), expected);
        }

        @Test
        @DisplayName("Should give the same tree when flattening grouped code twice")
        void shouldReachFixedPointForNestedBlanks() {
            String source = String.join("\n",
                    "class A {",
                    "    int x;",
                    "",
                    "    void f() {",
                    "        one();",
                    "",
                    "        two();",
                    "    }",
                    "}");
            IndentationNode<String> once = StructureCorrector.flattenVirtual(
                    StructureCorrector.groupBlocks(IndentationParser.parseTree(source)));
            IndentationNode<String> expected = TreeUtils.duplicateTree(once);

            assertSameTree(StructureCorrector.flattenVirtual(once), expected);
        }

        @Test
        @DisplayName("Should keep labeled virtual nodes")
        void shouldKeepLabeledVirtualNodes() {
            IndentationNode<String> before = top(
                    virtual(0, List.of(line(0, 0, "x", List.of())), "block"),
                    line(0, 1, "y", List.of()));

            IndentationNode<String> after = StructureCorrector.flattenVirtual(TreeUtils.duplicateTree(before));

            assertSameTree(after, before);
        }
    }
}
