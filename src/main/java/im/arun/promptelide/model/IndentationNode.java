package im.arun.promptelide.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A node of an indentation tree.
 *
 * <p>The tree is a tagged variant over {@link NodeType}; callers switch on {@link #getType()}
 * rather than probing for fields. Every node carries an optional label whose type depends on
 * the pipeline phase: {@code String} tags while parsing, {@code Boolean} focus markers, and
 * {@code Double} weights after weighting.
 *
 * <p>Nodes are mutable. Structural passes rewrite children in place.
 *
 * @param <L> label type of the current phase
 */
public abstract class IndentationNode<L> {

    @Getter
    @Setter
    private L label;

    private List<IndentationNode<L>> children;

    protected IndentationNode(List<IndentationNode<L>> children, L label) {
        this.children = children != null ? children : new ArrayList<>();
        this.label = label;
    }

    public abstract NodeType getType();

    /**
     * Indentation in columns. The top node reports -1 so that it is less indented than any line.
     *
     * @throws IllegalStateException for blank nodes, which carry no indentation
     */
    public abstract int getIndentation();

    public List<IndentationNode<L>> getChildren() {
        return children;
    }

    public void setChildren(List<IndentationNode<L>> children) {
        this.children = children;
    }

    public boolean isTop() {
        return getType() == NodeType.TOP;
    }

    public boolean isVirtual() {
        return getType() == NodeType.VIRTUAL;
    }

    public boolean isLine() {
        return getType() == NodeType.LINE;
    }

    public boolean isBlank() {
        return getType() == NodeType.BLANK;
    }

    /**
     * Whether this node stands for a source line, i.e. is a line or a blank node.
     */
    public boolean hasLineNumber() {
        return isLine() || isBlank();
    }

    /**
     * @throws IllegalStateException for top and virtual nodes
     */
    public int getLineNumber() {
        throw new IllegalStateException(getType() + " node has no line number");
    }

    public static <L> TopNode<L> top() {
        return new TopNode<>(new ArrayList<>());
    }

    public static <L> TopNode<L> top(List<IndentationNode<L>> children) {
        return new TopNode<>(new ArrayList<>(children));
    }

    @SafeVarargs
    public static <L> TopNode<L> top(IndentationNode<L>... children) {
        return top(Arrays.asList(children));
    }

    public static <L> VirtualNode<L> virtual(int indentation, List<IndentationNode<L>> children) {
        return new VirtualNode<>(indentation, new ArrayList<>(children), null);
    }

    public static <L> VirtualNode<L> virtual(int indentation, List<IndentationNode<L>> children, L label) {
        return new VirtualNode<>(indentation, new ArrayList<>(children), label);
    }

    public static <L> LineNode<L> line(int indentation, int lineNumber, String sourceLine,
                                       List<IndentationNode<L>> children) {
        return new LineNode<>(indentation, lineNumber, sourceLine, new ArrayList<>(children), null);
    }

    public static <L> LineNode<L> line(int indentation, int lineNumber, String sourceLine,
                                       List<IndentationNode<L>> children, L label) {
        return new LineNode<>(indentation, lineNumber, sourceLine, new ArrayList<>(children), label);
    }

    public static <L> BlankNode<L> blank(int lineNumber) {
        return new BlankNode<>(lineNumber, null);
    }
}
