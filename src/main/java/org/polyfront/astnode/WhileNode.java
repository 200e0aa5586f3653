package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

public class WhileNode extends AbstractNode {
    public final Node condition;
    public final Node body;

    public WhileNode(SourceInfo info, Node condition, Node body) {
        super(info);
        this.condition = condition;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
