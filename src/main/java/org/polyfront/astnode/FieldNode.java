package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;

/**
 * A member of a record, class body, object literal or struct.
 * <ul>
 *   <li>STMT: a definition; value holds the {@link DefinitionNode}, key is null</li>
 *   <li>DYNAMIC: a computed key and its value</li>
 *   <li>SPREAD: {@code ...expr} in value, key is null</li>
 * </ul>
 */
public class FieldNode extends AbstractNode {

    public enum Kind {STMT, DYNAMIC, SPREAD}

    public final Kind kind;
    public final Node key;
    public final Node value;

    public FieldNode(Kind kind, Node key, Node value) {
        super(key != null ? key.getInfo() : value.getInfo());
        this.kind = kind;
        this.key = key;
        this.value = value;
    }

    public static FieldNode stmt(DefinitionNode definition) {
        return new FieldNode(Kind.STMT, null, definition);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
