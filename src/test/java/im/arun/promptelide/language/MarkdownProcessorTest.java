package im.arun.promptelide.language;

import im.arun.promptelide.model.IndentationNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static im.arun.promptelide.model.IndentationNode.blank;
import static im.arun.promptelide.model.IndentationNode.line;
import static im.arun.promptelide.model.IndentationNode.top;
import static im.arun.promptelide.model.IndentationNode.virtual;
import static im.arun.promptelide.tree.TreeAssertions.assertSameTree;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MarkdownProcessor Tests")
class MarkdownProcessorTest {

    @Test
    @DisplayName("Should nest sections under their headings and group paragraphs")
    void shouldBuildHeadingHierarchy() {
        String source = String.join("\n",
                "A",
                "",
                "# B",
                "C",
                "D",
                "",
                "## E",
                "F",
                "G",
                "",
                "# H",
                "I",
                "",
                "### J",
                "K",
                "",
                "L",
                "M");

        IndentationNode<String> tree = IndentationParser.parseTree(source, "markdown");

        IndentationNode<String> expected = top(
                virtual(0, List.of(line(0, 0, "A", List.of()), blank(1))),
                virtual(0, List.of(
                        line(0, 2, "# B", List.of(
                                virtual(0, List.of(line(0, 3, "C", List.of()), line(0, 4, "D", List.of()), blank(5))),
                                line(0, 6, "## E", List.of(
                                        line(0, 7, "F", List.of()),
                                        line(0, 8, "G", List.of()),
                                        blank(9)), MarkdownProcessor.SUBHEADING)), MarkdownProcessor.HEADING),
                        line(0, 10, "# H", List.of(
                                virtual(0, List.of(line(0, 11, "I", List.of()), blank(12))),
                                line(0, 13, "### J", List.of(
                                        virtual(0, List.of(line(0, 14, "K", List.of()), blank(15))),
                                        virtual(0, List.of(line(0, 16, "L", List.of()), line(0, 17, "M", List.of())))),
                                        MarkdownProcessor.SUBSUBHEADING)), MarkdownProcessor.HEADING))));
        assertSameTree(tree, expected);
    }

    @Test
    @DisplayName("Should only treat a hash followed by a space as a heading")
    void shouldRequireSpaceAfterHash() {
        IndentationNode<String> tree = IndentationParser.parseTree("#hashtag\n# Title\ntext", "markdown");

        assertThat(tree.getChildren()).hasSize(2);
        assertThat(tree.getChildren().get(0).getLabel()).isNull();
        assertThat(tree.getChildren().get(1).getLabel()).isEqualTo(MarkdownProcessor.HEADING);
        assertThat(tree.getChildren().get(1).getChildren()).hasSize(1);
    }

    @Test
    @DisplayName("Should not label an inline triple hash as a heading")
    void shouldAnchorSubsubheadings() {
        IndentationNode<String> tree = IndentationParser.parseTree("see ### below", "markdown");

        assertThat(tree.getChildren().get(0).getLabel()).isNull();
    }
}
