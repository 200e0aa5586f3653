package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * The IfNode class represents an "if" statement.
 * The parts of the statement are: "condition", "thenBranch" and "elseBranch".
 */
public class IfNode extends AbstractNode {
    public final Node condition;
    public final Node thenBranch;

    /**
     * The false branch; null when there is none.
     */
    public final Node elseBranch;

    public IfNode(SourceInfo info, Node condition, Node thenBranch, Node elseBranch) {
        super(info);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
