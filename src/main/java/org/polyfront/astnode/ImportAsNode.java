package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Imports a module as a whole, bound to an alias when one is given
 * ({@code import * as ns from "m"}, {@code #include <stdio.h>}).
 */
public class ImportAsNode extends AbstractNode {
    public final ModuleName module;
    public final IdNode alias;

    public ImportAsNode(SourceInfo info, ModuleName module, IdNode alias) {
        super(info);
        this.module = module;
        this.alias = alias;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
