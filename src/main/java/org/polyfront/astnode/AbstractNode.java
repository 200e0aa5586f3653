package org.polyfront.astnode;

import org.polyfront.astvisitor.PrintVisitor;
import org.polyfront.lexer.SourceInfo;

/**
 * Abstract base class for Generic AST nodes. Every node carries the
 * {@link SourceInfo} of the token it was built from, so positions map back to
 * the original token stream.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor
 */
public abstract class AbstractNode implements Node {
    public SourceInfo info;

    protected AbstractNode(SourceInfo info) {
        this.info = info;
    }

    @Override
    public SourceInfo getInfo() {
        return info;
    }

    /**
     * Returns a string representation of the syntax tree.
     *
     * @return a string representation of the syntax tree
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }
}
