package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

public class AssignNode extends AbstractNode {
    public final Node left;
    public final Node right;

    /**
     * @param info position of the {@code =} token
     */
    public AssignNode(Node left, SourceInfo info, Node right) {
        super(info);
        this.left = left;
        this.right = right;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
