package org.polyfront.astvisitor;

import org.polyfront.astnode.*;

import java.util.List;

/**
 * A visitor that walks every child of every node in source order and does
 * nothing else. Subclasses override the nodes they are interested in and call
 * {@code super.visit(node)} to keep descending.
 */
public class TraversingVisitor implements Visitor {

    protected void visitChild(Node child) {
        if (child != null) {
            child.accept(this);
        }
    }

    protected void visitChildren(List<? extends Node> children) {
        for (Node child : children) {
            visitChild(child);
        }
    }

    @Override
    public void visit(ProgramNode node) {
        visitChildren(node.items);
    }

    @Override
    public void visit(LiteralNode node) {
    }

    @Override
    public void visit(IdNode node) {
    }

    @Override
    public void visit(SpecialNode node) {
    }

    @Override
    public void visit(CallNode node) {
        visitChild(node.function);
        visitChildren(node.arguments);
    }

    @Override
    public void visit(ArgumentNode node) {
        visitChild(node.value);
    }

    @Override
    public void visit(AssignNode node) {
        visitChild(node.left);
        visitChild(node.right);
    }

    @Override
    public void visit(AssignOpNode node) {
        visitChild(node.left);
        visitChild(node.right);
    }

    @Override
    public void visit(ContainerNode node) {
        visitChildren(node.elements);
    }

    @Override
    public void visit(RecordNode node) {
        visitChildren(node.fields);
    }

    @Override
    public void visit(DotAccessNode node) {
        visitChild(node.expr);
        visitChild(node.field);
    }

    @Override
    public void visit(ArrayAccessNode node) {
        visitChild(node.array);
        visitChild(node.index);
    }

    @Override
    public void visit(ConditionalNode node) {
        visitChild(node.condition);
        visitChild(node.thenExpr);
        visitChild(node.elseExpr);
    }

    @Override
    public void visit(LambdaNode node) {
        visitChild(node.function);
    }

    @Override
    public void visit(AnonClassNode node) {
        visitChild(node.classDefinition);
    }

    @Override
    public void visit(CastNode node) {
        visitChild(node.type);
        visitChild(node.expr);
    }

    @Override
    public void visit(SeqNode node) {
        visitChildren(node.exprs);
    }

    @Override
    public void visit(RefNode node) {
        visitChild(node.expr);
    }

    @Override
    public void visit(DeRefNode node) {
        visitChild(node.expr);
    }

    @Override
    public void visit(EllipsisNode node) {
    }

    @Override
    public void visit(XmlNode node) {
        visitChild(node.tag);
        visitChildren(node.attributes);
        visitChildren(node.body);
    }

    @Override
    public void visit(OtherExprNode node) {
        visitChildren(node.parts);
    }

    @Override
    public void visit(ExprStmtNode node) {
        visitChild(node.expr);
    }

    @Override
    public void visit(BlockNode node) {
        visitChildren(node.elements);
    }

    @Override
    public void visit(IfNode node) {
        visitChild(node.condition);
        visitChild(node.thenBranch);
        visitChild(node.elseBranch);
    }

    @Override
    public void visit(WhileNode node) {
        visitChild(node.condition);
        visitChild(node.body);
    }

    @Override
    public void visit(DoWhileNode node) {
        visitChild(node.body);
        visitChild(node.condition);
    }

    @Override
    public void visit(ForNode node) {
        visitChildren(node.init);
        visitChild(node.condition);
        visitChild(node.next);
        visitChild(node.body);
    }

    @Override
    public void visit(ForEachNode node) {
        visitChild(node.pattern);
        visitChild(node.collection);
        visitChild(node.body);
    }

    @Override
    public void visit(SwitchNode node) {
        visitChild(node.discriminant);
        visitChildren(node.cases);
    }

    @Override
    public void visit(CaseNode node) {
        visitChild(node.value);
        visitChildren(node.body);
    }

    @Override
    public void visit(ReturnNode node) {
        visitChild(node.value);
    }

    @Override
    public void visit(JumpNode node) {
        visitChild(node.label);
    }

    @Override
    public void visit(LabelNode node) {
        visitChild(node.label);
        visitChild(node.body);
    }

    @Override
    public void visit(ThrowNode node) {
        visitChild(node.value);
    }

    @Override
    public void visit(TryNode node) {
        visitChild(node.body);
        visitChildren(node.catches);
        visitChild(node.finallyBody);
    }

    @Override
    public void visit(CatchNode node) {
        visitChild(node.pattern);
        visitChild(node.body);
    }

    @Override
    public void visit(OtherStmtNode node) {
        visitChildren(node.parts);
    }

    @Override
    public void visit(PatternNode node) {
        visitChild(node.value);
        visitChild(node.type);
    }

    @Override
    public void visit(TypeNode node) {
        visitChildren(node.path);
        visitChildren(node.args);
        visitChild(node.result);
        visitChild(node.size);
    }

    @Override
    public void visit(EntityNode node) {
        visitChild(node.name);
        visitChildren(node.attributes);
        visitChildren(node.typeParameters);
    }

    @Override
    public void visit(AttributeNode node) {
        visitChild(node.name);
        visitChildren(node.arguments);
    }

    @Override
    public void visit(DefinitionNode node) {
        visitChild(node.entity);
        visitChild(node.definition);
    }

    @Override
    public void visit(FunctionDefinitionNode node) {
        visitChildren(node.parameters);
        visitChild(node.returnType);
        visitChild(node.body);
        visitChildren(node.properties);
    }

    @Override
    public void visit(ParameterNode node) {
        visitChild(node.name);
        visitChild(node.type);
        visitChild(node.defaultValue);
        visitChildren(node.attributes);
    }

    @Override
    public void visit(VariableDefinitionNode node) {
        visitChild(node.init);
        visitChild(node.type);
    }

    @Override
    public void visit(TypeDefinitionNode node) {
        visitChildren(node.fields);
        visitChildren(node.alternatives);
        visitChild(node.alias);
    }

    @Override
    public void visit(OrTypeElementNode node) {
        visitChild(node.name);
        visitChild(node.type);
        visitChild(node.value);
    }

    @Override
    public void visit(FieldNode node) {
        visitChild(node.key);
        visitChild(node.value);
    }

    @Override
    public void visit(ClassDefinitionNode node) {
        visitChildren(node.parents);
        visitChildren(node.parameters);
        visitChildren(node.body);
    }

    @Override
    public void visit(MacroDefinitionNode node) {
        visitChildren(node.parameters);
        visitChild(node.body);
    }

    @Override
    public void visit(ImportFromNode node) {
        visitChild(node.name);
        visitChild(node.alias);
    }

    @Override
    public void visit(ImportAsNode node) {
        visitChild(node.alias);
    }

    @Override
    public void visit(ImportAllNode node) {
    }

    @Override
    public void visit(PackageNode node) {
        visitChildren(node.path);
    }

    @Override
    public void visit(ExportNode node) {
        visitChild(node.name);
    }

    @Override
    public void visit(OtherDirectiveNode node) {
        visitChildren(node.parts);
    }
}
