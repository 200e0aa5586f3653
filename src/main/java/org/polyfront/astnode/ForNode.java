package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * The ForNode class represents a classic three-part loop
 * {@code for (init; condition; next) body}.
 */
public class ForNode extends AbstractNode {
    /**
     * Declarations or expressions run once before the loop; may be empty.
     */
    public final List<Node> init;
    // null when omitted
    public final Node condition;
    // null when omitted
    public final Node next;
    public final Node body;

    public ForNode(SourceInfo info, List<Node> init, Node condition, Node next, Node body) {
        super(info);
        this.init = init;
        this.condition = condition;
        this.next = next;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
