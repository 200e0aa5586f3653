package org.polyfront.cst;

import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * Concrete syntax tree of the Scala-family grammar produced by the
 * {@code ScalaParser}.
 * <p>
 * Each syntactic category is a closed set of record variants with a
 * {@code ...Todo} variant for constructs that are recognized but not modelled.
 * Every accepted token is reachable from the tree, directly or through a
 * {@link SourceInfo}. Nullable components are documented on the record.
 */
public final class ScalaCst {

    private ScalaCst() {
    }

    // ------------------------------------------------------------------
    // Names and literals
    // ------------------------------------------------------------------

    /**
     * A plain, back-quoted or operator identifier. {@code this} and {@code _} are
     * also represented as identifiers.
     */
    public record Ident(String name, SourceInfo info) {
    }

    public enum LiteralKind {INT, FLOAT, CHAR, STRING, BOOL, NULL}

    public record Literal(LiteralKind kind, String text, SourceInfo info) {
    }

    // ------------------------------------------------------------------
    // Directives
    // ------------------------------------------------------------------

    /**
     * {@code a => b} or {@code a => _}; alias is null for a plain selector.
     */
    public record ImportSelector(Ident name, SourceInfo arrow, Ident alias) {
    }

    public interface ImportSpec {
    }

    public record ImportId(Ident name) implements ImportSpec {
    }

    public record ImportWildcard(SourceInfo underscore) implements ImportSpec {
    }

    public record ImportSelectors(SourceInfo lbrace, List<ImportSelector> selectors, SourceInfo rbrace)
            implements ImportSpec {
    }

    /**
     * {@code stableId . spec}; the path is the stable identifier before the last dot.
     */
    public record ImportExpr(List<Ident> path, ImportSpec spec) {
    }

    public record Import(SourceInfo importTok, List<ImportExpr> exprs) {
    }

    public record Package(SourceInfo packageTok, List<Ident> name) {
    }

    // ------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------

    public interface Type {
    }

    public record TyName(List<Ident> path) implements Type {
    }

    public record TyApp(Type type, SourceInfo lbracket, List<Type> args, SourceInfo rbracket) implements Type {
    }

    public record TyTuple(SourceInfo lparen, List<Type> types, SourceInfo rparen) implements Type {
    }

    public record TyFunction(List<Type> params, SourceInfo arrow, Type result) implements Type {
    }

    public record TyTodo(String category, SourceInfo info) implements Type {
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    public interface Expr {
    }

    public record L(Literal literal) implements Expr {
    }

    /**
     * A path such as {@code a.b.c}. Selections on arbitrary expressions use {@link DotAccess}.
     */
    public record Name(List<Ident> path) implements Expr {
    }

    public record Tuple(SourceInfo lparen, List<Expr> elements, SourceInfo rparen) implements Expr {
    }

    public record DotAccess(Expr expr, SourceInfo dot, Ident name) implements Expr {
    }

    /**
     * Application to one or more argument lists: {@code f(a)(b) { block }}.
     */
    public record Call(Expr fn, List<Arguments> arguments) implements Expr {
    }

    public record InstanciatedExpr(Expr expr, SourceInfo lbracket, List<Type> types, SourceInfo rbracket)
            implements Expr {
    }

    public record TypedExpr(Expr expr, SourceInfo colon, Type type) implements Expr {
    }

    public record Infix(Expr left, Ident op, Expr right) implements Expr {
    }

    public record Prefix(Ident op, Expr expr) implements Expr {
    }

    public record Assign(Expr lhs, SourceInfo eq, Expr rhs) implements Expr {
    }

    /**
     * {@code new T(args)}; arguments may be empty.
     */
    public record New(SourceInfo newTok, Type type, List<Arguments> arguments) implements Expr {
    }

    public record BlockExpr(SourceInfo lbrace, List<BlockStat> stats, SourceInfo rbrace) implements Expr {
    }

    /**
     * A statement used in expression position.
     */
    public record S(Stmt stmt) implements Expr {
    }

    public record ExprTodo(String category, SourceInfo info) implements Expr {
    }

    public interface Arguments {
    }

    public record Args(SourceInfo lparen, List<Expr> args, SourceInfo rparen) implements Arguments {
    }

    public record ArgBlock(BlockExpr block) implements Arguments {
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    public interface Stmt {
    }

    /**
     * elseBranch and elseTok are null without an else branch.
     */
    public record If(SourceInfo ifTok, Expr cond, Expr then, SourceInfo elseTok, Expr elseBranch) implements Stmt {
    }

    public record While(SourceInfo whileTok, Expr cond, Expr body) implements Stmt {
    }

    /**
     * value is null for a bare {@code return}.
     */
    public record Return(SourceInfo returnTok, Expr value) implements Stmt {
    }

    public record Throw(SourceInfo throwTok, Expr value) implements Stmt {
    }

    // ------------------------------------------------------------------
    // Block and template statements
    // ------------------------------------------------------------------

    public interface BlockStat {
    }

    public record D(Definition definition) implements BlockStat {
    }

    public record I(Import importClause) implements BlockStat {
    }

    public record E(Expr expr) implements BlockStat {
    }

    /**
     * {@code package a.b} heading the rest of the unit.
     */
    public record P(Package pkg) implements BlockStat {
    }

    /**
     * {@code package a.b { ... }}.
     */
    public record Packaging(Package pkg, SourceInfo lbrace, List<BlockStat> stats, SourceInfo rbrace)
            implements BlockStat {
    }

    public record BlockTodo(String category, SourceInfo info) implements BlockStat {
    }

    // ------------------------------------------------------------------
    // Attributes
    // ------------------------------------------------------------------

    public enum ModifierKind {
        ABSTRACT, FINAL, SEALED, IMPLICIT, LAZY,
        PRIVATE, PROTECTED,
        OVERRIDE,
        CASE_CLASS_OR_OBJECT, PACKAGE_OBJECT
    }

    public interface Attribute {
    }

    /**
     * qualifier is the {@code [x]} of {@code private[x]} or null.
     */
    public record Modifier(ModifierKind kind, SourceInfo info, Ident qualifier) implements Attribute {
    }

    public record Annotation(SourceInfo at, Type type, List<Arguments> arguments) implements Attribute {
    }

    // ------------------------------------------------------------------
    // Definitions
    // ------------------------------------------------------------------

    public interface Definition {
    }

    public record DefEnt(Entity entity, DefinitionKind kind) implements Definition {
    }

    public record DefTodo(String category, SourceInfo info) implements Definition {
    }

    public record Entity(Ident name, List<Attribute> attrs, List<Ident> typeParams) {
    }

    public interface DefinitionKind {
    }

    public enum FunctionKind {DEF, LAMBDA_ARROW}

    /**
     * returnType and body are null when absent (an abstract {@code def}).
     */
    public record FuncDef(FunctionKind kind, SourceInfo kindTok, List<List<Binding>> params,
                          Type returnType, Expr body) implements DefinitionKind {
    }

    public enum VariableKind {VAL, VAR}

    /**
     * type and body are null when absent.
     */
    public record VarDef(VariableKind kind, SourceInfo kindTok, Type type, Expr body) implements DefinitionKind {
    }

    public record TypeDef(SourceInfo typeTok, Type body) implements DefinitionKind {
    }

    public enum TemplateKind {CLASS, TRAIT, OBJECT}

    /**
     * parentArgs are the constructor arguments given to the first parent;
     * body is null when the template has no braces.
     */
    public record Template(TemplateKind kind, SourceInfo kindTok, List<List<Binding>> classParams,
                           List<Type> parents, List<Arguments> parentArgs, List<BlockStat> body)
            implements DefinitionKind {
    }

    /**
     * type and implicitTok are null when absent.
     */
    public record Binding(Ident name, Type type, SourceInfo implicitTok) {
    }

    public record Program(List<BlockStat> stats, SourceInfo eof) {
    }
}
