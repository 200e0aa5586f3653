package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

/**
 * A class expression without a name.
 */
public class AnonClassNode extends AbstractNode {
    public final ClassDefinitionNode classDefinition;

    public AnonClassNode(ClassDefinitionNode classDefinition) {
        super(classDefinition.getInfo());
        this.classDefinition = classDefinition;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
