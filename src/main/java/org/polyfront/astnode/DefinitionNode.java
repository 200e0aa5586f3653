package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

/**
 * A definition statement: an entity and what it is bound to. Used for
 * functions, variables, types, classes and macros alike.
 */
public class DefinitionNode extends AbstractNode {
    public final EntityNode entity;
    public final DefinitionKind definition;

    public DefinitionNode(EntityNode entity, DefinitionKind definition) {
        super(entity.getInfo());
        this.entity = entity;
        this.definition = definition;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
