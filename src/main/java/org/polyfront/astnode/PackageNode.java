package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * A package declaration. It applies to the following statements, up to a
 * "PackageEnd" {@link OtherDirectiveNode} or the end of the program.
 */
public class PackageNode extends AbstractNode {
    public final List<IdNode> path;

    public PackageNode(SourceInfo info, List<IdNode> path) {
        super(info);
        this.path = path;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
