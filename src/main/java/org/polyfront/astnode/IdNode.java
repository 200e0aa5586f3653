package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * The IdNode class represents an identifier, either a use or the name of a
 * definition. Each identifier owns a resolution slot ({@link IdInfo}).
 */
public class IdNode extends AbstractNode {
    /**
     * The identifier name.
     */
    public final String name;

    /**
     * The resolution cell; never null, possibly unresolved.
     */
    public final IdInfo idInfo;

    public IdNode(String name, SourceInfo info) {
        this(name, info, new IdInfo());
    }

    public IdNode(String name, SourceInfo info, IdInfo idInfo) {
        super(info);
        this.name = name;
        this.idInfo = idInfo;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
