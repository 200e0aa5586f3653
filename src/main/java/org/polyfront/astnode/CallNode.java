package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

import java.util.List;

/**
 * Application of a function, method, constructor or operator to arguments.
 */
public class CallNode extends AbstractNode {
    public final Node function;
    public final List<ArgumentNode> arguments;

    public CallNode(Node function, List<ArgumentNode> arguments) {
        super(function.getInfo());
        this.function = function;
        this.arguments = arguments;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
