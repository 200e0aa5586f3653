package org.polyfront.astnode;

import org.polyfront.astvisitor.Visitor;
import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * The TypeNode class represents a type expression.
 * <ul>
 *   <li>BUILTIN: a primitive type, name is the builtin name</li>
 *   <li>NAMED: a (possibly qualified) type name in path</li>
 *   <li>APPLY: path applied to args</li>
 *   <li>FUNCTION: args are the parameter types, result the return type</li>
 *   <li>ARRAY: args holds the element type, size may be null</li>
 *   <li>POINTER: args holds the pointed-to type</li>
 *   <li>TUPLE: args are the components</li>
 * </ul>
 */
public class TypeNode extends AbstractNode {

    public enum Kind {BUILTIN, NAMED, APPLY, FUNCTION, ARRAY, POINTER, TUPLE}

    public final Kind kind;
    public final List<IdNode> path;
    public final List<TypeNode> args;
    public final TypeNode result;
    public final Node size;

    public TypeNode(Kind kind, List<IdNode> path, List<TypeNode> args, TypeNode result, Node size, SourceInfo info) {
        super(info);
        this.kind = kind;
        this.path = path;
        this.args = args;
        this.result = result;
        this.size = size;
    }

    public static TypeNode builtin(IdNode name) {
        return new TypeNode(Kind.BUILTIN, List.of(name), List.of(), null, null, name.getInfo());
    }

    public static TypeNode named(List<IdNode> path) {
        return new TypeNode(Kind.NAMED, path, List.of(), null, null, path.get(0).getInfo());
    }

    public static TypeNode apply(List<IdNode> path, List<TypeNode> args) {
        return new TypeNode(Kind.APPLY, path, args, null, null, path.get(0).getInfo());
    }

    public static TypeNode function(List<TypeNode> params, TypeNode result, SourceInfo info) {
        return new TypeNode(Kind.FUNCTION, List.of(), params, result, null, info);
    }

    public static TypeNode array(TypeNode element, Node size, SourceInfo info) {
        return new TypeNode(Kind.ARRAY, List.of(), List.of(element), null, size, info);
    }

    public static TypeNode pointer(TypeNode pointed, SourceInfo info) {
        return new TypeNode(Kind.POINTER, List.of(), List.of(pointed), null, null, info);
    }

    public static TypeNode tuple(List<TypeNode> types, SourceInfo info) {
        return new TypeNode(Kind.TUPLE, List.of(), types, null, null, info);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
