package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Imports one name from a module, optionally under an alias:
 * {@code import {name as alias} from "module"}.
 */
public class ImportFromNode extends AbstractNode {
    public final ModuleName module;
    public final IdNode name;
    // null without rename
    public final IdNode alias;

    public ImportFromNode(SourceInfo info, ModuleName module, IdNode name, IdNode alias) {
        super(info);
        this.module = module;
        this.name = name;
        this.alias = alias;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
