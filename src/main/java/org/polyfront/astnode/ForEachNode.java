package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Iteration of a pattern over a collection, as in {@code for (x in obj)}.
 */
public class ForEachNode extends AbstractNode {
    public final PatternNode pattern;
    // Position of the "in" keyword
    public final SourceInfo inInfo;
    public final Node collection;
    public final Node body;

    public ForEachNode(SourceInfo info, PatternNode pattern, SourceInfo inInfo, Node collection, Node body) {
        super(info);
        this.pattern = pattern;
        this.inInfo = inInfo;
        this.collection = collection;
        this.body = body;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
