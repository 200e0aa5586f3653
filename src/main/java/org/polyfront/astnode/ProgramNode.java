package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * The root of a lowered compilation unit.
 */
public class ProgramNode extends AbstractNode {
    public final String fileName;
    public final List<Node> items;

    public ProgramNode(String fileName, List<Node> items) {
        super(SourceInfo.fake(fileName));
        this.fileName = fileName;
        this.items = items;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
