package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Compound assignment such as {@code a += b}.
 */
public class AssignOpNode extends AbstractNode {
    public final Node left;
    public final Operator operator;
    public final Node right;

    public AssignOpNode(Node left, Operator operator, SourceInfo info, Node right) {
        super(info);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
