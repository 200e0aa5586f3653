package org.polyfront.astvisitor;

import org.polyfront.astnode.*;

import java.util.List;

/*
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    private void header(Node node, String name, String detail) {
        appendIndent();
        sb.append(name).append(":");
        if (detail != null) {
            sb.append(" ").append(detail);
        }
        sb.append("  pos:");
        if (node.getInfo() == null || node.getInfo().isFake()) {
            sb.append("fake");
        } else {
            sb.append(node.getInfo().line).append(":").append(node.getInfo().column);
        }
        sb.append("\n");
    }

    private void child(String label, Node child) {
        if (child == null) {
            return;
        }
        appendIndent();
        sb.append(label).append(":\n");
        indentLevel++;
        child.accept(this);
        indentLevel--;
    }

    private void children(String label, List<? extends Node> list) {
        if (list.isEmpty()) {
            return;
        }
        appendIndent();
        sb.append(label).append(":\n");
        indentLevel++;
        for (Node element : list) {
            if (element == null) {
                appendIndent();
                sb.append("null\n");
            } else {
                element.accept(this);
            }
        }
        indentLevel--;
    }

    @Override
    public void visit(ProgramNode node) {
        header(node, "ProgramNode", node.fileName);
        indentLevel++;
        children("items", node.items);
        indentLevel--;
    }

    @Override
    public void visit(LiteralNode node) {
        header(node, "LiteralNode", node.kind + " " + node.value);
    }

    @Override
    public void visit(IdNode node) {
        header(node, "IdNode", node.name + " [" + node.idInfo + "]");
    }

    @Override
    public void visit(SpecialNode node) {
        header(node, "SpecialNode", node.operator == null ? node.kind.toString() : node.kind + " " + node.operator);
    }

    @Override
    public void visit(CallNode node) {
        header(node, "CallNode", null);
        indentLevel++;
        child("function", node.function);
        children("arguments", node.arguments);
        indentLevel--;
    }

    @Override
    public void visit(ArgumentNode node) {
        header(node, "ArgumentNode", node.kind.toString());
        indentLevel++;
        child("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(AssignNode node) {
        header(node, "AssignNode", null);
        indentLevel++;
        child("left", node.left);
        child("right", node.right);
        indentLevel--;
    }

    @Override
    public void visit(AssignOpNode node) {
        header(node, "AssignOpNode", node.operator.toString());
        indentLevel++;
        child("left", node.left);
        child("right", node.right);
        indentLevel--;
    }

    @Override
    public void visit(ContainerNode node) {
        header(node, "ContainerNode", node.kind.toString());
        indentLevel++;
        children("elements", node.elements);
        indentLevel--;
    }

    @Override
    public void visit(RecordNode node) {
        header(node, "RecordNode", null);
        indentLevel++;
        children("fields", node.fields);
        indentLevel--;
    }

    @Override
    public void visit(DotAccessNode node) {
        header(node, "DotAccessNode", null);
        indentLevel++;
        child("expr", node.expr);
        child("field", node.field);
        indentLevel--;
    }

    @Override
    public void visit(ArrayAccessNode node) {
        header(node, "ArrayAccessNode", null);
        indentLevel++;
        child("array", node.array);
        child("index", node.index);
        indentLevel--;
    }

    @Override
    public void visit(ConditionalNode node) {
        header(node, "ConditionalNode", null);
        indentLevel++;
        child("condition", node.condition);
        child("thenExpr", node.thenExpr);
        child("elseExpr", node.elseExpr);
        indentLevel--;
    }

    @Override
    public void visit(LambdaNode node) {
        header(node, "LambdaNode", null);
        indentLevel++;
        child("function", node.function);
        indentLevel--;
    }

    @Override
    public void visit(AnonClassNode node) {
        header(node, "AnonClassNode", null);
        indentLevel++;
        child("classDefinition", node.classDefinition);
        indentLevel--;
    }

    @Override
    public void visit(CastNode node) {
        header(node, "CastNode", null);
        indentLevel++;
        child("type", node.type);
        child("expr", node.expr);
        indentLevel--;
    }

    @Override
    public void visit(SeqNode node) {
        header(node, "SeqNode", null);
        indentLevel++;
        children("exprs", node.exprs);
        indentLevel--;
    }

    @Override
    public void visit(RefNode node) {
        header(node, "RefNode", null);
        indentLevel++;
        child("expr", node.expr);
        indentLevel--;
    }

    @Override
    public void visit(DeRefNode node) {
        header(node, "DeRefNode", null);
        indentLevel++;
        child("expr", node.expr);
        indentLevel--;
    }

    @Override
    public void visit(EllipsisNode node) {
        header(node, "EllipsisNode", null);
    }

    @Override
    public void visit(XmlNode node) {
        header(node, "XmlNode", null);
        indentLevel++;
        child("tag", node.tag);
        children("attributes", node.attributes);
        children("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(OtherExprNode node) {
        header(node, "OtherExprNode", node.category);
        indentLevel++;
        children("parts", node.parts);
        indentLevel--;
    }

    @Override
    public void visit(ExprStmtNode node) {
        header(node, "ExprStmtNode", null);
        indentLevel++;
        child("expr", node.expr);
        indentLevel--;
    }

    @Override
    public void visit(BlockNode node) {
        header(node, "BlockNode", null);
        indentLevel++;
        children("elements", node.elements);
        indentLevel--;
    }

    @Override
    public void visit(IfNode node) {
        header(node, "IfNode", null);
        indentLevel++;
        child("condition", node.condition);
        child("thenBranch", node.thenBranch);
        child("elseBranch", node.elseBranch);
        indentLevel--;
    }

    @Override
    public void visit(WhileNode node) {
        header(node, "WhileNode", null);
        indentLevel++;
        child("condition", node.condition);
        child("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(DoWhileNode node) {
        header(node, "DoWhileNode", null);
        indentLevel++;
        child("body", node.body);
        child("condition", node.condition);
        indentLevel--;
    }

    @Override
    public void visit(ForNode node) {
        header(node, "ForNode", null);
        indentLevel++;
        children("init", node.init);
        child("condition", node.condition);
        child("next", node.next);
        child("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(ForEachNode node) {
        header(node, "ForEachNode", null);
        indentLevel++;
        child("pattern", node.pattern);
        child("collection", node.collection);
        child("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(SwitchNode node) {
        header(node, "SwitchNode", null);
        indentLevel++;
        child("discriminant", node.discriminant);
        children("cases", node.cases);
        indentLevel--;
    }

    @Override
    public void visit(CaseNode node) {
        header(node, "CaseNode", null);
        indentLevel++;
        child("value", node.value);
        children("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(ReturnNode node) {
        header(node, "ReturnNode", null);
        indentLevel++;
        child("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(JumpNode node) {
        header(node, "JumpNode", node.kind.toString());
        indentLevel++;
        child("label", node.label);
        indentLevel--;
    }

    @Override
    public void visit(LabelNode node) {
        header(node, "LabelNode", null);
        indentLevel++;
        child("label", node.label);
        child("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(ThrowNode node) {
        header(node, "ThrowNode", null);
        indentLevel++;
        child("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(TryNode node) {
        header(node, "TryNode", null);
        indentLevel++;
        child("body", node.body);
        children("catches", node.catches);
        child("finallyBody", node.finallyBody);
        indentLevel--;
    }

    @Override
    public void visit(CatchNode node) {
        header(node, "CatchNode", null);
        indentLevel++;
        child("pattern", node.pattern);
        child("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(OtherStmtNode node) {
        header(node, "OtherStmtNode", node.category);
        indentLevel++;
        children("parts", node.parts);
        indentLevel--;
    }

    @Override
    public void visit(PatternNode node) {
        header(node, "PatternNode", node.kind.toString());
        indentLevel++;
        child("value", node.value);
        child("type", node.type);
        indentLevel--;
    }

    @Override
    public void visit(TypeNode node) {
        header(node, "TypeNode", node.kind.toString());
        indentLevel++;
        children("path", node.path);
        children("args", node.args);
        child("result", node.result);
        child("size", node.size);
        indentLevel--;
    }

    @Override
    public void visit(EntityNode node) {
        header(node, "EntityNode", null);
        indentLevel++;
        child("name", node.name);
        children("attributes", node.attributes);
        children("typeParameters", node.typeParameters);
        indentLevel--;
    }

    @Override
    public void visit(AttributeNode node) {
        header(node, "AttributeNode", node.keyword == null ? "named" : node.keyword.toString());
        indentLevel++;
        child("name", node.name);
        children("arguments", node.arguments);
        indentLevel--;
    }

    @Override
    public void visit(DefinitionNode node) {
        header(node, "DefinitionNode", null);
        indentLevel++;
        child("entity", node.entity);
        child("definition", node.definition);
        indentLevel--;
    }

    @Override
    public void visit(FunctionDefinitionNode node) {
        header(node, "FunctionDefinitionNode", node.kind.toString());
        indentLevel++;
        children("parameters", node.parameters);
        child("returnType", node.returnType);
        child("body", node.body);
        children("properties", node.properties);
        indentLevel--;
    }

    @Override
    public void visit(ParameterNode node) {
        header(node, "ParameterNode", node.kind.toString());
        indentLevel++;
        child("name", node.name);
        child("type", node.type);
        child("defaultValue", node.defaultValue);
        children("attributes", node.attributes);
        indentLevel--;
    }

    @Override
    public void visit(VariableDefinitionNode node) {
        header(node, "VariableDefinitionNode", null);
        indentLevel++;
        child("init", node.init);
        child("type", node.type);
        indentLevel--;
    }

    @Override
    public void visit(TypeDefinitionNode node) {
        header(node, "TypeDefinitionNode", node.kind.toString());
        indentLevel++;
        children("fields", node.fields);
        children("alternatives", node.alternatives);
        child("alias", node.alias);
        indentLevel--;
    }

    @Override
    public void visit(OrTypeElementNode node) {
        header(node, "OrTypeElementNode", node.kind.toString());
        indentLevel++;
        child("name", node.name);
        child("type", node.type);
        child("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(FieldNode node) {
        header(node, "FieldNode", node.kind.toString());
        indentLevel++;
        child("key", node.key);
        child("value", node.value);
        indentLevel--;
    }

    @Override
    public void visit(ClassDefinitionNode node) {
        header(node, "ClassDefinitionNode", node.kind.toString());
        indentLevel++;
        children("parents", node.parents);
        children("parameters", node.parameters);
        children("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(MacroDefinitionNode node) {
        header(node, "MacroDefinitionNode", null);
        indentLevel++;
        children("parameters", node.parameters);
        child("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(ImportFromNode node) {
        header(node, "ImportFromNode", node.module.toString());
        indentLevel++;
        child("name", node.name);
        child("alias", node.alias);
        indentLevel--;
    }

    @Override
    public void visit(ImportAsNode node) {
        header(node, "ImportAsNode", node.module.toString());
        indentLevel++;
        child("alias", node.alias);
        indentLevel--;
    }

    @Override
    public void visit(ImportAllNode node) {
        header(node, "ImportAllNode", node.module.toString());
    }

    @Override
    public void visit(PackageNode node) {
        header(node, "PackageNode", null);
        indentLevel++;
        children("path", node.path);
        indentLevel--;
    }

    @Override
    public void visit(ExportNode node) {
        header(node, "ExportNode", null);
        indentLevel++;
        child("name", node.name);
        indentLevel--;
    }

    @Override
    public void visit(OtherDirectiveNode node) {
        header(node, "OtherDirectiveNode", node.category);
        indentLevel++;
        children("parts", node.parts);
        indentLevel--;
    }
}
