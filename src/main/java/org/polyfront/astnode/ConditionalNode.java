package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

/**
 * The ternary {@code cond ? then : otherwise}.
 */
public class ConditionalNode extends AbstractNode {
    public final Node condition;
    public final Node thenExpr;
    public final Node elseExpr;

    public ConditionalNode(Node condition, Node thenExpr, Node elseExpr) {
        super(condition.getInfo());
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
