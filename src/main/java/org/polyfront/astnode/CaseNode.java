package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * One clause of a {@link SwitchNode}; the value is null for {@code default}.
 */
public class CaseNode extends AbstractNode {
    public final Node value;
    public final List<Node> body;

    public CaseNode(SourceInfo info, Node value, List<Node> body) {
        super(info);
        this.value = value;
        this.body = body;
    }

    public boolean isDefault() {
        return value == null;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
