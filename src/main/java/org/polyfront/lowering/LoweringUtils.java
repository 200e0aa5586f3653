package org.polyfront.lowering;

import org.polyfront.astnode.ArgumentNode;
import org.polyfront.astnode.AttributeNode;
import org.polyfront.astnode.BlockNode;
import org.polyfront.astnode.CallNode;
import org.polyfront.astnode.DefinitionNode;
import org.polyfront.astnode.EntityNode;
import org.polyfront.astnode.IdInfo;
import org.polyfront.astnode.IdNode;
import org.polyfront.astnode.KeywordAttribute;
import org.polyfront.astnode.Node;
import org.polyfront.astnode.Operator;
import org.polyfront.astnode.ResolvedName;
import org.polyfront.astnode.SpecialKind;
import org.polyfront.astnode.SpecialNode;
import org.polyfront.astnode.VariableDefinitionNode;
import org.polyfront.lexer.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Small constructors shared by the lowering transforms.
 */
public class LoweringUtils {

    public static SourceInfo fake(String text) {
        return SourceInfo.fake(text);
    }

    /**
     * Wraps a lowered statement list into a single statement node. A single
     * statement is returned as is; otherwise a block with fake braces is built.
     */
    public static Node stmtOfStmts(List<Node> stmts) {
        if (stmts.size() == 1) {
            return stmts.get(0);
        }
        return fakeBlock(stmts);
    }

    public static BlockNode fakeBlock(List<Node> stmts) {
        return new BlockNode(fake("{"), stmts, fake("}"));
    }

    public static List<ArgumentNode> args(Node... values) {
        List<ArgumentNode> args = new ArrayList<>();
        for (Node value : values) {
            args.add(ArgumentNode.arg(value));
        }
        return args;
    }

    public static List<ArgumentNode> args(List<Node> values) {
        List<ArgumentNode> args = new ArrayList<>();
        for (Node value : values) {
            args.add(ArgumentNode.arg(value));
        }
        return args;
    }

    public static CallNode special(SpecialKind kind, SourceInfo info, Node... values) {
        return new CallNode(new SpecialNode(kind, info), args(values));
    }

    public static CallNode operator(Operator op, SourceInfo info, Node... values) {
        return new CallNode(SpecialNode.operator(op, info), args(values));
    }

    /**
     * A reference to a binding whose resolution is already known, such as a
     * synthesized temporary.
     */
    public static IdNode resolvedId(String name, SourceInfo info, ResolvedName resolved) {
        return new IdNode(name, info, new IdInfo(resolved));
    }

    /**
     * Builds {@code <kind> name = init} where kind is one of the keyword attributes
     * VAR, LET or CONST. The defining identifier is tagged like a use site.
     */
    public static DefinitionNode variable(IdNode name, KeywordAttribute kind, SourceInfo kindInfo, Node init) {
        name.idInfo.setResolved(ResolvedName.local(name.info));
        List<AttributeNode> attrs = new ArrayList<>();
        attrs.add(new AttributeNode(kind, kindInfo));
        return new DefinitionNode(new EntityNode(name, attrs), new VariableDefinitionNode(kindInfo, init, null));
    }

    /**
     * A named member of a record or object literal. The name is a label, not a
     * binding, so its resolution slot is left empty.
     */
    public static DefinitionNode field(IdNode name, Node value) {
        return new DefinitionNode(new EntityNode(name, new ArrayList<>()),
                new VariableDefinitionNode(name.info, value, null));
    }
}
