package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

/**
 * One alternative of a sum type: an enum constant with an optional value, or a
 * union member with its type.
 */
public class OrTypeElementNode extends AbstractNode {

    public enum Kind {ENUM, UNION}

    public final Kind kind;
    public final IdNode name;
    // UNION only
    public final TypeNode type;
    // ENUM only, null without explicit value
    public final Node value;

    public OrTypeElementNode(Kind kind, IdNode name, TypeNode type, Node value) {
        super(name.getInfo());
        this.kind = kind;
        this.name = name;
        this.type = type;
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
