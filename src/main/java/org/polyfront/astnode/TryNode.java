package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

public class TryNode extends AbstractNode {
    public final Node body;
    public final List<CatchNode> catches;
    // null without finally
    public final Node finallyBody;

    public TryNode(SourceInfo info, Node body, List<CatchNode> catches, Node finallyBody) {
        super(info);
        this.body = body;
        this.catches = catches;
        this.finallyBody = finallyBody;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
