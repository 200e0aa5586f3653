package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

public class DoWhileNode extends AbstractNode {
    public final Node body;
    public final Node condition;

    public DoWhileNode(SourceInfo info, Node body, Node condition) {
        super(info);
        this.body = body;
        this.condition = condition;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
