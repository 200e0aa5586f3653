package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * A preprocessor macro; the body is null for a flag macro.
 */
public class MacroDefinitionNode extends AbstractNode implements DefinitionKind {
    public final List<IdNode> parameters;
    public final Node body;

    public MacroDefinitionNode(SourceInfo info, List<IdNode> parameters, Node body) {
        super(info);
        this.parameters = parameters;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
