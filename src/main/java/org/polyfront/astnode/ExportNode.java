package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Exports a binding of the current module under its own name.
 */
public class ExportNode extends AbstractNode {
    public final IdNode name;

    public ExportNode(SourceInfo info, IdNode name) {
        super(info);
        this.name = name;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
