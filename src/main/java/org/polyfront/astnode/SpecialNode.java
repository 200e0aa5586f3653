package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * A built-in form. Operators are special nodes of kind OPERATOR applied
 * through a {@link CallNode}.
 */
public class SpecialNode extends AbstractNode {
    public final SpecialKind kind;
    // Only set when kind is OPERATOR
    public final Operator operator;

    public SpecialNode(SpecialKind kind, SourceInfo info) {
        this(kind, null, info);
    }

    public SpecialNode(SpecialKind kind, Operator operator, SourceInfo info) {
        super(info);
        this.kind = kind;
        this.operator = operator;
    }

    public static SpecialNode operator(Operator operator, SourceInfo info) {
        return new SpecialNode(SpecialKind.OPERATOR, operator, info);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
