package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * A cast, or a type ascription such as Scala's {@code e: T}.
 */
public class CastNode extends AbstractNode {
    public final TypeNode type;
    public final Node expr;

    public CastNode(TypeNode type, SourceInfo info, Node expr) {
        super(info);
        this.type = type;
        this.expr = expr;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
