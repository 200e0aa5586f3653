package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Taking the address of an expression ({@code &x}).
 */
public class RefNode extends AbstractNode {
    public final Node expr;

    public RefNode(SourceInfo info, Node expr) {
        super(info);
        this.expr = expr;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
