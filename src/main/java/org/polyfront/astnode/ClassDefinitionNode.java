package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * Classes, traits, singleton objects and interfaces.
 */
public class ClassDefinitionNode extends AbstractNode implements DefinitionKind {

    public enum Kind {CLASS, TRAIT, OBJECT, INTERFACE}

    public final Kind kind;
    /**
     * Parent types; with constructor arguments the first parent is a {@link CallNode}.
     */
    public final List<Node> parents;
    public final List<ParameterNode> parameters;
    public final List<FieldNode> body;

    public ClassDefinitionNode(Kind kind, SourceInfo info, List<Node> parents, List<ParameterNode> parameters,
                               List<FieldNode> body) {
        super(info);
        this.kind = kind;
        this.parents = parents;
        this.parameters = parameters;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
