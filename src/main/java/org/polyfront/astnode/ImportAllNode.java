package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Wildcard import of every member of a module ({@code import math._}).
 */
public class ImportAllNode extends AbstractNode {
    public final ModuleName module;
    public final SourceInfo wildcard;

    public ImportAllNode(SourceInfo info, ModuleName module, SourceInfo wildcard) {
        super(info);
        this.module = module;
        this.wildcard = wildcard;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
