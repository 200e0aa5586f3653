package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * The FunctionDefinitionNode class represents functions, methods, arrows and lambdas.
 * <p>
 * Getter, setter, generator and async markers are carried in the ordered
 * {@link #properties} list instead of separate node kinds; storage attributes
 * such as {@code static} live on the enclosing entity.
 */
public class FunctionDefinitionNode extends AbstractNode implements DefinitionKind {

    public enum Kind {FUNCTION, METHOD, ARROW, LAMBDA}

    public final Kind kind;
    public final List<ParameterNode> parameters;
    // null when not declared
    public final TypeNode returnType;
    // null for a prototype or abstract declaration
    public final Node body;
    public final List<AttributeNode> properties;

    public FunctionDefinitionNode(Kind kind, SourceInfo info, List<ParameterNode> parameters, TypeNode returnType,
                                  Node body, List<AttributeNode> properties) {
        super(info);
        this.kind = kind;
        this.parameters = parameters;
        this.returnType = returnType;
        this.body = body;
        this.properties = properties;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
