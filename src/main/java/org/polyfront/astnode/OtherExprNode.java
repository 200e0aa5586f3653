package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * An expression the shared vocabulary has no node for, kept with a category
 * name and its parts.
 */
public class OtherExprNode extends AbstractNode {
    public final String category;
    public final List<Node> parts;

    public OtherExprNode(String category, List<Node> parts, SourceInfo info) {
        super(info);
        this.category = category;
        this.parts = parts;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
