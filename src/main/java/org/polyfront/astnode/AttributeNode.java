package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * A keyword attribute ({@code static}, {@code private}...) or a named attribute
 * such as an annotation with its arguments.
 */
public class AttributeNode extends AbstractNode {
    // null for a named attribute
    public final KeywordAttribute keyword;
    // null for a keyword attribute
    public final TypeNode name;
    public final List<ArgumentNode> arguments;

    public AttributeNode(KeywordAttribute keyword, SourceInfo info) {
        this(keyword, null, List.of(), info);
    }

    public AttributeNode(KeywordAttribute keyword, TypeNode name, List<ArgumentNode> arguments, SourceInfo info) {
        super(info);
        this.keyword = keyword;
        this.name = name;
        this.arguments = arguments;
    }

    public static AttributeNode named(TypeNode name, List<ArgumentNode> arguments, SourceInfo info) {
        return new AttributeNode(null, name, arguments, info);
    }

    public boolean isKeyword(KeywordAttribute expected) {
        return keyword == expected;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
