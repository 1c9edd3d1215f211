package im.arun.promptelide.model;

import lombok.Getter;

import java.util.List;

/**
 * Grouping that is not directly visible in the indentation, e.g. a paragraph of lines
 * or the body of an {@code if} before its {@code } else {}.
 */
public class VirtualNode<L> extends IndentationNode<L> {

    @Getter
    private final int indentation;

    public VirtualNode(int indentation, List<IndentationNode<L>> children, L label) {
        super(children, label);
        this.indentation = indentation;
    }

    @Override
    public NodeType getType() {
        return NodeType.VIRTUAL;
    }
}
