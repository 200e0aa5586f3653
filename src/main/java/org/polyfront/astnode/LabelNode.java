package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

/**
 * A labeled statement.
 */
public class LabelNode extends AbstractNode {
    public final IdNode label;
    public final Node body;

    public LabelNode(IdNode label, Node body) {
        super(label.getInfo());
        this.label = label;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
