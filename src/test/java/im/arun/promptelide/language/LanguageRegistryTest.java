package im.arun.promptelide.language;

import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.tree.TreeDescriber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LanguageRegistry Tests")
class LanguageRegistryTest {

    @Test
    @DisplayName("Should provide processors for java and markdown")
    void shouldRegisterBuiltInLanguages() {
        LanguageRegistry registry = LanguageRegistry.createDefault();

        assertThat(registry.languages()).containsExactlyInAnyOrder("java", "markdown");
        assertThat(registry.processorFor("java")).isInstanceOf(JavaProcessor.class);
        assertThat(registry.processorFor("markdown")).isInstanceOf(MarkdownProcessor.class);
    }

    @Test
    @DisplayName("Should fall back to the generic processor")
    void shouldFallBackToGenericProcessor() {
        LanguageRegistry registry = LanguageRegistry.createDefault();

        assertThat(registry.processorFor("python")).isInstanceOf(GenericProcessor.class);
        assertThat(registry.processorFor(null)).isInstanceOf(GenericProcessor.class);
        assertThat(registry.hasProcessor("python")).isFalse();
        assertThat(registry.hasProcessor(null)).isFalse();
    }

    @Test
    @DisplayName("Should use a registered processor when parsing")
    void shouldUseRegisteredProcessor() {
        LanguageRegistry registry = LanguageRegistry.createDefault();
        registry.register("shout", tree -> {
            tree.setLabel("shouted");
            return tree;
        });

        IndentationNode<String> tree = IndentationParser.parseTree("a\n  b", "shout", registry);

        assertThat(registry.hasProcessor("shout")).isTrue();
        assertThat(tree.getLabel()).isEqualTo("shouted");
        assertThat(TreeDescriber.deparseTree(tree)).isEqualTo("a\n  b\n");
        assertThat(LanguageRegistry.defaultRegistry().hasProcessor("shout")).isFalse();
    }

    @Test
    @DisplayName("Should label brackets for unknown languages")
    void shouldLabelBracketsGenerically() {
        IndentationNode<String> tree = IndentationParser.parseTree("f(\n  x\n)", "unknown");

        assertThat(tree.getChildren()).hasSize(1);
        assertThat(tree.getChildren().get(0).getChildren().get(1).getLabel()).isEqualTo("closer");
    }
}
