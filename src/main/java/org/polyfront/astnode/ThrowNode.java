package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

public class ThrowNode extends AbstractNode {
    public final Node value;

    public ThrowNode(SourceInfo info, Node value) {
        super(info);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
