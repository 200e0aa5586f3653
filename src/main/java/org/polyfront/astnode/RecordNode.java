package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * Object literal or record initializer; every element is a {@link FieldNode}.
 */
public class RecordNode extends AbstractNode {
    public final List<FieldNode> fields;

    public RecordNode(List<FieldNode> fields, SourceInfo info) {
        super(info);
        this.fields = fields;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
