package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Dereferencing a pointer ({@code *p}).
 */
public class DeRefNode extends AbstractNode {
    public final Node expr;

    public DeRefNode(SourceInfo info, Node expr) {
        super(info);
        this.expr = expr;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
