package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

public class SwitchNode extends AbstractNode {
    public final Node discriminant;
    public final List<CaseNode> cases;

    public SwitchNode(SourceInfo info, Node discriminant, List<CaseNode> cases) {
        super(info);
        this.discriminant = discriminant;
        this.cases = cases;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
