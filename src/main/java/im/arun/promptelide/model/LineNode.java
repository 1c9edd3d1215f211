package im.arun.promptelide.model;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * A non-blank source line and the lines nested under it.
 */
public class LineNode<L> extends IndentationNode<L> {

    @Getter
    private final int indentation;

    @Setter
    private int lineNumber;

    /** The source line without its leading whitespace. */
    @Getter
    private final String sourceLine;

    public LineNode(int indentation, int lineNumber, String sourceLine, List<IndentationNode<L>> children, L label) {
        super(children, label);
        if (sourceLine == null || sourceLine.isEmpty()) {
            throw new IllegalArgumentException("Cannot create a line node with an empty source line");
        }
        this.indentation = indentation;
        this.lineNumber = lineNumber;
        this.sourceLine = sourceLine;
    }

    @Override
    public NodeType getType() {
        return NodeType.LINE;
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }
}
