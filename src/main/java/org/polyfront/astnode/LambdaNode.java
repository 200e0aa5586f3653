package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

/**
 * An anonymous function in expression position.
 */
public class LambdaNode extends AbstractNode {
    public final FunctionDefinitionNode function;

    public LambdaNode(FunctionDefinitionNode function) {
        super(function.getInfo());
        this.function = function;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
