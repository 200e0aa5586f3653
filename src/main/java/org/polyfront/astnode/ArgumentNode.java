package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

/**
 * One argument of a {@link CallNode}: an expression, or a type as in
 * {@code sizeof(int)}.
 */
public class ArgumentNode extends AbstractNode {

    public enum Kind {ARG, ARG_TYPE}

    public final Kind kind;
    public final Node value;

    public ArgumentNode(Kind kind, Node value) {
        super(value.getInfo());
        this.kind = kind;
        this.value = value;
    }

    public static ArgumentNode arg(Node value) {
        return new ArgumentNode(Kind.ARG, value);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
