package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * Array, list or tuple literal.
 */
public class ContainerNode extends AbstractNode {

    public enum Kind {ARRAY, LIST, TUPLE}

    public final Kind kind;
    public final List<Node> elements;

    public ContainerNode(Kind kind, List<Node> elements, SourceInfo info) {
        super(info);
        this.kind = kind;
        this.elements = elements;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
