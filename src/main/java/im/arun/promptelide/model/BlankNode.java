package im.arun.promptelide.model;

import lombok.Setter;

import java.util.Collections;
import java.util.List;

/**
 * A blank (empty or whitespace-only) source line. Its children are always empty.
 */
public class BlankNode<L> extends IndentationNode<L> {

    @Setter
    private int lineNumber;

    public BlankNode(int lineNumber, L label) {
        super(Collections.emptyList(), label);
        this.lineNumber = lineNumber;
    }

    @Override
    public NodeType getType() {
        return NodeType.BLANK;
    }

    @Override
    public int getIndentation() {
        throw new IllegalStateException("Blank nodes carry no indentation");
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public List<IndentationNode<L>> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public void setChildren(List<IndentationNode<L>> children) {
        if (children != null && !children.isEmpty()) {
            throw new IllegalArgumentException("Blank nodes cannot have children");
        }
    }
}
