package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

/**
 * An expression used as a statement.
 */
public class ExprStmtNode extends AbstractNode {
    public final Node expr;

    public ExprStmtNode(Node expr) {
        super(expr.getInfo());
        this.expr = expr;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
