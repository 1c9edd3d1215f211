package im.arun.promptelide.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static im.arun.promptelide.model.IndentationNode.blank;
import static im.arun.promptelide.model.IndentationNode.line;
import static im.arun.promptelide.model.IndentationNode.top;
import static im.arun.promptelide.model.IndentationNode.virtual;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IndentationNode Tests")
class IndentationNodeTest {

    @Test
    @DisplayName("Should report type, indentation and line numbers per node kind")
    void shouldExposeNodeKinds() {
        TopNode<String> top = top();
        VirtualNode<String> virtual = virtual(2, List.of());
        LineNode<String> line = line(4, 3, "x", List.of());
        BlankNode<String> blank = blank(7);

        assertThat(top.isTop()).isTrue();
        assertThat(top.getIndentation()).isEqualTo(-1);
        assertThat(virtual.isVirtual()).isTrue();
        assertThat(virtual.getIndentation()).isEqualTo(2);
        assertThat(line.getLineNumber()).isEqualTo(3);
        assertThat(line.hasLineNumber()).isTrue();
        assertThat(blank.getLineNumber()).isEqualTo(7);
        assertThat(blank.hasLineNumber()).isTrue();
        assertThat(virtual.hasLineNumber()).isFalse();
    }

    @Test
    @DisplayName("Should refuse line numbers for structural nodes")
    void shouldRejectLineNumberOfStructuralNodes() {
        assertThatThrownBy(() -> IndentationNode.<String>top().getLineNumber())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> IndentationNode.<String>virtual(0, List.of()).getLineNumber())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should keep blank nodes childless and without indentation")
    void shouldKeepBlankNodesChildless() {
        BlankNode<String> blank = blank(0);

        assertThat(blank.getChildren()).isEmpty();
        assertThatThrownBy(blank::getIndentation).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> blank.setChildren(List.of(line(0, 1, "x", List.of()))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject empty source lines")
    void shouldRejectEmptySourceLine() {
        assertThatThrownBy(() -> line(0, 0, "", List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should copy child lists handed to the factories")
    void shouldCopyChildLists() {
        List<IndentationNode<String>> children = new ArrayList<>();
        LineNode<String> parent = line(0, 0, "p", children);

        parent.getChildren().add(blank(1));

        assertThat(children).isEmpty();
    }
}
