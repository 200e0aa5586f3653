package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * The LiteralNode class represents a literal value. The value is kept as the
 * source text, so no precision is lost for numbers.
 */
public class LiteralNode extends AbstractNode {

    public enum Kind {BOOL, INT, FLOAT, CHAR, STRING, REGEXP, NULL, UNDEFINED, UNIT}

    public final Kind kind;
    public final String value;

    public LiteralNode(Kind kind, String value, SourceInfo info) {
        super(info);
        this.kind = kind;
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
