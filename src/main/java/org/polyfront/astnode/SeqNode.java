package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

import java.util.List;

/**
 * Comma sequence; the value is the last expression.
 */
public class SeqNode extends AbstractNode {
    public final List<Node> exprs;

    public SeqNode(List<Node> exprs) {
        super(exprs.get(0).getInfo());
        this.exprs = exprs;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
