package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * The BlockNode class represents a sequence of statements in braces.
 * Blocks that are synthesized by lowering carry fake braces.
 */
public class BlockNode extends AbstractNode {
    public final List<Node> elements;
    public final SourceInfo closeInfo;

    public BlockNode(SourceInfo info, List<Node> elements, SourceInfo closeInfo) {
        super(info);
        this.elements = elements;
        this.closeInfo = closeInfo;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
