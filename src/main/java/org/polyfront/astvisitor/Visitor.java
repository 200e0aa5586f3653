package org.polyfront.astvisitor;

import org.polyfront.astnode.*;

/**
 * Visitor over the Generic AST, one method per node class.
 * <p>
 * Implementations that only care about a few node kinds extend {@link TraversingVisitor}.
 */
public interface Visitor {

    void visit(ProgramNode node);

    void visit(LiteralNode node);

    void visit(IdNode node);

    void visit(SpecialNode node);

    void visit(CallNode node);

    void visit(ArgumentNode node);

    void visit(AssignNode node);

    void visit(AssignOpNode node);

    void visit(ContainerNode node);

    void visit(RecordNode node);

    void visit(DotAccessNode node);

    void visit(ArrayAccessNode node);

    void visit(ConditionalNode node);

    void visit(LambdaNode node);

    void visit(AnonClassNode node);

    void visit(CastNode node);

    void visit(SeqNode node);

    void visit(RefNode node);

    void visit(DeRefNode node);

    void visit(EllipsisNode node);

    void visit(XmlNode node);

    void visit(OtherExprNode node);

    void visit(ExprStmtNode node);

    void visit(BlockNode node);

    void visit(IfNode node);

    void visit(WhileNode node);

    void visit(DoWhileNode node);

    void visit(ForNode node);

    void visit(ForEachNode node);

    void visit(SwitchNode node);

    void visit(CaseNode node);

    void visit(ReturnNode node);

    void visit(JumpNode node);

    void visit(LabelNode node);

    void visit(ThrowNode node);

    void visit(TryNode node);

    void visit(CatchNode node);

    void visit(OtherStmtNode node);

    void visit(PatternNode node);

    void visit(TypeNode node);

    void visit(EntityNode node);

    void visit(AttributeNode node);

    void visit(DefinitionNode node);

    void visit(FunctionDefinitionNode node);

    void visit(ParameterNode node);

    void visit(VariableDefinitionNode node);

    void visit(TypeDefinitionNode node);

    void visit(OrTypeElementNode node);

    void visit(FieldNode node);

    void visit(ClassDefinitionNode node);

    void visit(MacroDefinitionNode node);

    void visit(ImportFromNode node);

    void visit(ImportAsNode node);

    void visit(ImportAllNode node);

    void visit(PackageNode node);

    void visit(ExportNode node);

    void visit(OtherDirectiveNode node);
}
