package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * An XML literal kept as such. Attributes are {@link FieldNode}s, the body
 * holds text literals, expressions and nested XML nodes.
 */
public class XmlNode extends AbstractNode {
    // null for a fragment
    public final IdNode tag;
    public final List<FieldNode> attributes;
    public final List<Node> body;

    public XmlNode(IdNode tag, List<FieldNode> attributes, List<Node> body, SourceInfo info) {
        super(info);
        this.tag = tag;
        this.attributes = attributes;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
