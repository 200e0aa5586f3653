package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * A module directive without a dedicated node: "ImportEffect", "ImportCss",
 * "PackageEnd".
 */
public class OtherDirectiveNode extends AbstractNode {
    public final String category;
    public final List<Node> parts;

    public OtherDirectiveNode(String category, List<Node> parts, SourceInfo info) {
        super(info);
        this.category = category;
        this.parts = parts;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
