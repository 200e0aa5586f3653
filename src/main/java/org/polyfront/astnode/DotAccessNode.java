package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Field selection {@code expr.field}. The field is an {@link IdNode}, or an
 * arbitrary expression for computed names.
 */
public class DotAccessNode extends AbstractNode {
    public final Node expr;
    public final Node field;

    public DotAccessNode(Node expr, SourceInfo info, Node field) {
        super(info);
        this.expr = expr;
        this.field = field;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
