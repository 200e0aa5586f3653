package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

import java.util.List;

/**
 * The named part of a definition: its name, attributes and type parameters.
 */
public class EntityNode extends AbstractNode {
    public final IdNode name;
    public final List<AttributeNode> attributes;
    public final List<IdNode> typeParameters;

    public EntityNode(IdNode name, List<AttributeNode> attributes, List<IdNode> typeParameters) {
        super(name.getInfo());
        this.name = name;
        this.attributes = attributes;
        this.typeParameters = typeParameters;
    }

    public EntityNode(IdNode name, List<AttributeNode> attributes) {
        this(name, attributes, List.of());
    }

    public boolean hasAttribute(KeywordAttribute keyword) {
        for (AttributeNode attribute : attributes) {
            if (attribute.isKeyword(keyword)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
