package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * A statement the shared vocabulary has no node for, such as inline assembly.
 */
public class OtherStmtNode extends AbstractNode {
    public final String category;
    public final List<Node> parts;

    public OtherStmtNode(String category, List<Node> parts, SourceInfo info) {
        super(info);
        this.category = category;
        this.parts = parts;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
