package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * The TypeDefinitionNode class represents a type definition:
 * <ul>
 *   <li>PRODUCT: a record of fields ({@code struct}), in {@link #fields}</li>
 *   <li>SUM: alternatives ({@code union}, {@code enum}), in {@link #alternatives}</li>
 *   <li>ALIAS: another name for {@link #alias}</li>
 * </ul>
 */
public class TypeDefinitionNode extends AbstractNode implements DefinitionKind {

    public enum Kind {PRODUCT, SUM, ALIAS}

    public final Kind kind;
    public final List<FieldNode> fields;
    public final List<OrTypeElementNode> alternatives;
    public final TypeNode alias;

    private TypeDefinitionNode(Kind kind, List<FieldNode> fields, List<OrTypeElementNode> alternatives,
                               TypeNode alias, SourceInfo info) {
        super(info);
        this.kind = kind;
        this.fields = fields;
        this.alternatives = alternatives;
        this.alias = alias;
    }

    public static TypeDefinitionNode product(List<FieldNode> fields, SourceInfo info) {
        return new TypeDefinitionNode(Kind.PRODUCT, fields, List.of(), null, info);
    }

    public static TypeDefinitionNode sum(List<OrTypeElementNode> alternatives, SourceInfo info) {
        return new TypeDefinitionNode(Kind.SUM, List.of(), alternatives, null, info);
    }

    public static TypeDefinitionNode alias(TypeNode alias, SourceInfo info) {
        return new TypeDefinitionNode(Kind.ALIAS, List.of(), List.of(), alias, info);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
