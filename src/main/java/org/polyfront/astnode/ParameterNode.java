package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * A formal parameter. Name, type and default value are each optional
 * (an unnamed C prototype parameter only has a type).
 */
public class ParameterNode extends AbstractNode {

    public enum Kind {CLASSIC, VARIADIC}

    public final Kind kind;
    public final IdNode name;
    public final TypeNode type;
    public final Node defaultValue;
    public final List<AttributeNode> attributes;

    public ParameterNode(Kind kind, IdNode name, TypeNode type, Node defaultValue, List<AttributeNode> attributes,
                         SourceInfo info) {
        super(info);
        this.kind = kind;
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.attributes = attributes;
    }

    public static ParameterNode classic(IdNode name, TypeNode type, Node defaultValue) {
        return new ParameterNode(Kind.CLASSIC, name, type, defaultValue, List.of(), name.getInfo());
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
