package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * A variable; initializer and type are null when absent.
 */
public class VariableDefinitionNode extends AbstractNode implements DefinitionKind {
    public final Node init;
    public final TypeNode type;

    public VariableDefinitionNode(SourceInfo info, Node init, TypeNode type) {
        super(info);
        this.init = init;
        this.type = type;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
