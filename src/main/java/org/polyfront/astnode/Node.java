package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * A node of the Generic AST.
 * <p>
 * The node set is the contract with every downstream consumer: changing the
 * shape of a node is a breaking change for all of them.
 */
public interface Node {

    void accept(Visitor visitor);

    /**
     * Position of the node; a fake info for synthesized nodes.
     */
    SourceInfo getInfo();
}
