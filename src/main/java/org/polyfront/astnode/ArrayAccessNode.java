package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

public class ArrayAccessNode extends AbstractNode {
    public final Node array;
    public final Node index;

    public ArrayAccessNode(Node array, SourceInfo info, Node index) {
        super(info);
        this.array = array;
        this.index = index;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
