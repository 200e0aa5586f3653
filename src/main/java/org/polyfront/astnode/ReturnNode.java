package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * A return statement; the value is null for a bare return. Implicit returns
 * synthesized by lowering carry a fake info.
 */
public class ReturnNode extends AbstractNode {
    public final Node value;

    public ReturnNode(SourceInfo info, Node value) {
        super(info);
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
