package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

public class EllipsisNode extends AbstractNode {

    public EllipsisNode(SourceInfo info) {
        super(info);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
