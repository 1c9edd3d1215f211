package im.arun.promptelide.model;

import java.util.List;

/**
 * Root of a parsed document.
 */
public class TopNode<L> extends IndentationNode<L> {

    public TopNode(List<IndentationNode<L>> children) {
        super(children, null);
    }

    @Override
    public NodeType getType() {
        return NodeType.TOP;
    }

    @Override
    public int getIndentation() {
        return -1;
    }
}
