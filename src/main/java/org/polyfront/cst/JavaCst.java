package org.polyfront.cst;

import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * Abstract-leaning syntax tree of a Java compilation unit, as handed to
 * {@code JavaToGeneric}.
 * <p>
 * Trees are built by callers. Java names are ambiguous without semantic
 * information, so {@code a.b.c} is kept as a {@link QualifiedName} and left to
 * the lowering to split.
 */
public final class JavaCst {

    private JavaCst() {
    }

    public record Name(String name, SourceInfo info) {
    }

    // ------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------

    public interface Type {
    }

    /**
     * {@code void}, {@code int} and the other primitive types.
     */
    public record TBasic(Name name) implements Type {
    }

    public record ClassTypePart(Name name, List<TypeArgument> args) {
    }

    /**
     * {@code java.util.Map<K, V>}; only the last part usually carries arguments.
     */
    public record TClass(List<ClassTypePart> parts) implements Type {
    }

    public record TArray(Type element) implements Type {
    }

    public interface TypeArgument {
    }

    public record TArgument(Type type) implements TypeArgument {
    }

    /**
     * {@code ?}, {@code ? extends T} or {@code ? super T}; bound is null for a bare {@code ?}.
     */
    public record TQuestion(SourceInfo question, boolean isSuper, Type bound) implements TypeArgument {
    }

    public record TypeParam(Name name, List<Type> bounds) {
    }

    // ------------------------------------------------------------------
    // Modifiers and annotations
    // ------------------------------------------------------------------

    public enum ModifierKind {
        PUBLIC, PROTECTED, PRIVATE,
        ABSTRACT, FINAL, STATIC,
        TRANSIENT, VOLATILE, NATIVE, STRICTFP, SYNCHRONIZED,
        DEFAULT
    }

    public interface Mod {
    }

    public record Modifier(ModifierKind kind, SourceInfo info) implements Mod {
    }

    /**
     * args is null when the annotation has no parentheses.
     */
    public record Annotation(SourceInfo at, List<Name> name, List<AnnotArg> args) implements Mod {
    }

    public interface AnnotArg {
    }

    public record AnnotValue(ElementValue value) implements AnnotArg {
    }

    /**
     * {@code key = value}
     */
    public record AnnotPair(Name key, SourceInfo eq, ElementValue value) implements AnnotArg {
    }

    public interface ElementValue {
    }

    public record AnnotExpr(Expr expr) implements ElementValue {
    }

    public record AnnotNested(Annotation annotation) implements ElementValue {
    }

    public record AnnotArray(SourceInfo lbrace, List<ElementValue> elements) implements ElementValue {
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    public interface Expr {
    }

    /**
     * A dotted name such as {@code x}, {@code this} or {@code java.lang.Math.PI}.
     */
    public record QualifiedName(List<Name> parts) implements Expr {
    }

    public record IntLit(String value, SourceInfo info) implements Expr {
    }

    public record FloatLit(String value, SourceInfo info) implements Expr {
    }

    public record StrLit(String value, SourceInfo info) implements Expr {
    }

    public record CharLit(String value, SourceInfo info) implements Expr {
    }

    public record BoolLit(boolean value, SourceInfo info) implements Expr {
    }

    public record NullLit(SourceInfo info) implements Expr {
    }

    /**
     * {@code String.class}
     */
    public record ClassLiteral(Type type, SourceInfo classTok) implements Expr {
    }

    /**
     * body is null unless the expression declares an anonymous class.
     */
    public record NewClass(SourceInfo newTok, Type type, List<Expr> args, List<Decl> body) implements Expr {
    }

    /**
     * {@code new int[n][]}: dimExprs holds {@code n}, extraDims counts the
     * trailing empty brackets. init is null without initializer.
     */
    public record NewArray(SourceInfo newTok, Type element, List<Expr> dimExprs, int extraDims, Init init)
            implements Expr {
    }

    /**
     * {@code outer.new Inner(args) { body }}
     */
    public record NewQualifiedClass(Expr outer, SourceInfo newTok, Type type, List<Expr> args, List<Decl> body)
            implements Expr {
    }

    /**
     * {@code target::method}; exactly one of target and targetType is set.
     */
    public record MethodRef(Expr target, Type targetType, SourceInfo colons, Name method) implements Expr {
    }

    public record Call(Expr fn, SourceInfo lparen, List<Expr> args, SourceInfo rparen) implements Expr {
    }

    public record Dot(Expr expr, SourceInfo dot, Name field) implements Expr {
    }

    public record ArrayAccess(Expr array, SourceInfo lbracket, Expr index) implements Expr {
    }

    public enum UnaryOp {PLUS, MINUS, TILDE, NOT}

    public record Unary(UnaryOp op, SourceInfo opTok, Expr expr) implements Expr {
    }

    public enum IncrDecr {INCR, DECR}

    public record Postfix(Expr expr, IncrDecr op, SourceInfo opTok) implements Expr {
    }

    public record Prefix(IncrDecr op, SourceInfo opTok, Expr expr) implements Expr {
    }

    public enum BinaryOp {
        PLUS, MINUS, MULT, DIV, MOD,
        // <<, >> and >>>
        SHL, SHR, USHR,
        BIT_AND, BIT_OR, BIT_XOR,
        AND, OR,
        LT, GT, LE, GE, EQ, NE
    }

    public record Infix(Expr left, BinaryOp op, SourceInfo opTok, Expr right) implements Expr {
    }

    public record Cast(SourceInfo lparen, Type type, Expr expr) implements Expr {
    }

    public record InstanceOf(Expr expr, SourceInfo instanceofTok, Type type) implements Expr {
    }

    public record Conditional(Expr cond, Expr then, Expr otherwise) implements Expr {
    }

    public record Assign(Expr lhs, SourceInfo eq, Expr rhs) implements Expr {
    }

    /**
     * {@code +=} and friends.
     */
    public record AssignOp(Expr lhs, BinaryOp op, SourceInfo opTok, Expr rhs) implements Expr {
    }

    /**
     * An expression-bodied lambda carries its expression in an {@link ExprSt}.
     */
    public record Lambda(List<Param> params, SourceInfo arrow, Stmt body) implements Expr {
    }

    public record Ellipsis(SourceInfo info) implements Expr {
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    public interface Stmt {
    }

    public record Empty(SourceInfo semicolon) implements Stmt {
    }

    public record Block(SourceInfo lbrace, List<Stmt> stmts, SourceInfo rbrace) implements Stmt {
    }

    public record ExprSt(Expr expr, SourceInfo semicolon) implements Stmt {
    }

    /**
     * otherwise is null without else branch.
     */
    public record If(SourceInfo ifTok, Expr cond, Stmt then, Stmt otherwise) implements Stmt {
    }

    public interface CaseLabel {
    }

    public record Case(SourceInfo caseTok, Expr expr) implements CaseLabel {
    }

    public record Default(SourceInfo defaultTok) implements CaseLabel {
    }

    /**
     * Consecutive labels sharing one statement list, as in {@code case 1: case 2: f();}.
     */
    public record SwitchGroup(List<CaseLabel> labels, List<Stmt> body) {
    }

    public record Switch(SourceInfo switchTok, Expr expr, List<SwitchGroup> groups) implements Stmt {
    }

    public record While(SourceInfo whileTok, Expr cond, Stmt body) implements Stmt {
    }

    public record Do(SourceInfo doTok, Stmt body, Expr cond) implements Stmt {
    }

    public interface ForControl {
    }

    public interface ForInit {
    }

    public record ForInitVars(List<VarWithInit> vars) implements ForInit {
    }

    public record ForInitExprs(List<Expr> exprs) implements ForInit {
    }

    /**
     * cond is null when omitted.
     */
    public record ForClassic(ForInit init, Expr cond, List<Expr> updates) implements ForControl {
    }

    public record Foreach(VarDef var, SourceInfo colon, Expr collection) implements ForControl {
    }

    public record For(SourceInfo forTok, ForControl control, Stmt body) implements Stmt {
    }

    /**
     * label is null for an unlabeled jump.
     */
    public record Break(SourceInfo breakTok, Name label) implements Stmt {
    }

    public record Continue(SourceInfo continueTok, Name label) implements Stmt {
    }

    /**
     * value is null for a bare return.
     */
    public record Return(SourceInfo returnTok, Expr value) implements Stmt {
    }

    public record Label(Name label, Stmt body) implements Stmt {
    }

    public record Sync(SourceInfo syncTok, Expr lock, Stmt body) implements Stmt {
    }

    public record Catch(SourceInfo catchTok, VarDef param, Block body) {
    }

    /**
     * finallyBody is null without finally clause.
     */
    public record Try(SourceInfo tryTok, Block body, List<Catch> catches, Block finallyBody) implements Stmt {
    }

    public record Throw(SourceInfo throwTok, Expr value) implements Stmt {
    }

    public record LocalVar(VarWithInit var) implements Stmt {
    }

    public record LocalClass(ClassDecl decl) implements Stmt {
    }

    /**
     * message is null for {@code assert e;}.
     */
    public record Assert(SourceInfo assertTok, Expr cond, Expr message) implements Stmt {
    }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    /**
     * type is null for the untyped parameters of a lambda.
     */
    public record VarDef(Name name, List<Mod> mods, Type type) {
    }

    public interface Init {
    }

    public record ExprInit(Expr expr) implements Init {
    }

    public record ArrayInit(SourceInfo lbrace, List<Init> elements, SourceInfo rbrace) implements Init {
    }

    /**
     * init is null without initializer.
     */
    public record VarWithInit(VarDef var, Init init) {
    }

    public interface Param {
    }

    public record ParamClassic(VarDef var) implements Param {
    }

    /**
     * {@code String... args}
     */
    public record ParamSpread(SourceInfo dots, VarDef var) implements Param {
    }

    /**
     * var.type is null for a constructor; body is null for an abstract or
     * interface method.
     */
    public record MethodDecl(VarDef var, List<TypeParam> typeParams, List<Param> params, List<Type> throwsList,
                             Block body) {
    }

    public enum ClassKind {CLASS, INTERFACE}

    /**
     * extendsType is null without extends clause; for an interface the
     * extended interfaces are in impls.
     */
    public record ClassDecl(SourceInfo kindTok, ClassKind kind, Name name, List<TypeParam> typeParams,
                            List<Mod> mods, Type extendsType, List<Type> impls, List<Decl> body) {
    }

    /**
     * args and body are null when absent.
     */
    public record EnumConstant(Name name, List<Expr> args, List<Decl> body) {
    }

    public record EnumDecl(SourceInfo enumTok, Name name, List<Mod> mods, List<Type> impls,
                           List<EnumConstant> constants, List<Decl> body) {
    }

    public record AnnotationTypeDecl(SourceInfo atTok, Name name, List<Mod> mods, List<Decl> body) {
    }

    public interface Decl {
    }

    public record ClassD(ClassDecl decl) implements Decl {
    }

    public record EnumD(EnumDecl decl) implements Decl {
    }

    public record AnnotationTypeD(AnnotationTypeDecl decl) implements Decl {
    }

    public record MethodD(MethodDecl decl) implements Decl {
    }

    public record FieldD(VarWithInit field) implements Decl {
    }

    /**
     * An instance or {@code static} initializer block.
     */
    public record InitD(boolean isStatic, Block body) implements Decl {
    }

    public record EmptyDecl(SourceInfo semicolon) implements Decl {
    }

    public record DeclEllipsis(SourceInfo info) implements Decl {
    }

    // ------------------------------------------------------------------
    // Compilation unit
    // ------------------------------------------------------------------

    public record PackageDecl(SourceInfo packageTok, List<Name> path) {
    }

    public interface ImportDecl {
    }

    /**
     * {@code import [static] a.b.*;}
     */
    public record ImportAll(SourceInfo importTok, boolean isStatic, List<Name> path, SourceInfo star)
            implements ImportDecl {
    }

    /**
     * {@code import [static] a.b.C;}
     */
    public record ImportFrom(SourceInfo importTok, boolean isStatic, List<Name> path, Name name)
            implements ImportDecl {
    }

    /**
     * pkg is null in the unnamed package.
     */
    public record CompilationUnit(PackageDecl pkg, List<ImportDecl> imports, List<Decl> decls) {
    }
}
