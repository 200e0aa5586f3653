package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

/**
 * {@code break}, {@code continue} and {@code goto}, with an optional label.
 */
public class JumpNode extends AbstractNode {

    public enum Kind {BREAK, CONTINUE, GOTO}

    public final Kind kind;
    // null for an unlabeled break or continue
    public final IdNode label;

    public JumpNode(Kind kind, SourceInfo info, IdNode label) {
        super(info);
        this.kind = kind;
        this.label = label;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
