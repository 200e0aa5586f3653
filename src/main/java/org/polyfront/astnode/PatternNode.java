package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * A binding pattern. Only the shapes needed by loops and catch clauses exist;
 * destructuring is desugared before it reaches the Generic AST.
 */
public class PatternNode extends AbstractNode {

    public enum Kind {ID, LITERAL, UNDERSCORE}

    public final Kind kind;
    // IdNode for ID, LiteralNode for LITERAL, null for UNDERSCORE
    public final Node value;
    // declared type of an ID pattern, as in {@code catch (IOException e)}; null when untyped
    public final TypeNode type;

    public PatternNode(Kind kind, Node value, SourceInfo info) {
        this(kind, value, null, info);
    }

    public PatternNode(Kind kind, Node value, TypeNode type, SourceInfo info) {
        super(info);
        this.kind = kind;
        this.value = value;
        this.type = type;
    }

    public static PatternNode id(IdNode id) {
        return new PatternNode(Kind.ID, id, id.getInfo());
    }

    public static PatternNode typed(IdNode id, TypeNode type) {
        return new PatternNode(Kind.ID, id, type, id.getInfo());
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
