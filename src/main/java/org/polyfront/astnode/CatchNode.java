package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * A catch clause; the pattern is an underscore pattern when nothing is bound.
 */
public class CatchNode extends AbstractNode {
    public final PatternNode pattern;
    public final Node body;

    public CatchNode(SourceInfo info, PatternNode pattern, Node body) {
        super(info);
        this.pattern = pattern;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
