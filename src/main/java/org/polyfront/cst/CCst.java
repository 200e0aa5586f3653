package org.polyfront.cst;

import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * Concrete syntax tree of C after preprocessing directives were kept as
 * toplevel items, as handed to {@code CToGeneric}.
 * <p>
 * Trees are built by callers. Names that may be absent in the source (anonymous
 * structs, unnamed parameters) are null.
 */
public final class CCst {

    private CCst() {
    }

    public record Name(String name, SourceInfo info) {
    }

    // ------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------

    public interface Type {
    }

    /**
     * {@code int}, {@code unsigned long}, {@code char}...
     */
    public record TBase(Name name) implements Type {
    }

    public record TPointer(SourceInfo star, Type type) implements Type {
    }

    /**
     * size is null for {@code t[]}.
     */
    public record TArray(Expr size, Type type) implements Type {
    }

    public record TFunction(Type returnType, List<Parameter> params) implements Type {
    }

    public enum StructKind {STRUCT, UNION}

    public record TStructName(StructKind kind, Name name) implements Type {
    }

    public record TEnumName(Name name) implements Type {
    }

    /**
     * A typedef name.
     */
    public record TTypeName(Name name) implements Type {
    }

    /**
     * name is null for unnamed parameters, as in prototypes.
     */
    public record Parameter(Name name, Type type) {
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    public interface Expr {
    }

    public record IntLit(String value, SourceInfo info) implements Expr {
    }

    public record FloatLit(String value, SourceInfo info) implements Expr {
    }

    public record StrLit(String value, SourceInfo info) implements Expr {
    }

    public record CharLit(String value, SourceInfo info) implements Expr {
    }

    public record Id(Name name) implements Expr {
    }

    /**
     * {@code ...} in a call to a variadic macro.
     */
    public record Ellipses(SourceInfo info) implements Expr {
    }

    public interface Argument {
    }

    public record Arg(Expr expr) implements Argument {
    }

    /**
     * A type passed as argument, as in {@code va_arg(ap, int)}.
     */
    public record ArgType(Type type) implements Argument {
    }

    public record Call(Expr fn, SourceInfo lparen, List<Argument> args, SourceInfo rparen) implements Expr {
    }

    public enum ArithOp {
        PLUS, MINUS, MULT, DIV, MOD,
        DEC_LEFT, DEC_RIGHT,
        AND, OR, XOR
    }

    public enum LogicalOp {
        INF, SUP, INF_EQ, SUP_EQ, EQ, NOT_EQ,
        AND_LOG, OR_LOG
    }

    /**
     * op is null for {@code =}, otherwise the operator of {@code +=} and friends.
     */
    public record Assign(Expr lhs, ArithOp op, SourceInfo opTok, Expr rhs) implements Expr {
    }

    public record ArrayAccess(Expr array, SourceInfo lbracket, Expr index, SourceInfo rbracket) implements Expr {
    }

    /**
     * {@code e.field}
     */
    public record RecordAccess(Expr expr, SourceInfo dot, Name field) implements Expr {
    }

    /**
     * {@code e->field}
     */
    public record RecordPtAccess(Expr expr, SourceInfo arrow, Name field) implements Expr {
    }

    public record Cast(SourceInfo lparen, Type type, Expr expr) implements Expr {
    }

    public enum IncrDecr {INCR, DECR}

    public record Postfix(Expr expr, IncrDecr op, SourceInfo opTok) implements Expr {
    }

    public record Prefix(IncrDecr op, SourceInfo opTok, Expr expr) implements Expr {
    }

    public enum UnaryOp {GET_REF, DE_REF, UN_PLUS, UN_MINUS, TILDE, NOT, GET_REF_LABEL}

    public record Unary(UnaryOp op, SourceInfo opTok, Expr expr) implements Expr {
    }

    public interface BinaryOp {
    }

    public record Arith(ArithOp op) implements BinaryOp {
    }

    public record Logical(LogicalOp op) implements BinaryOp {
    }

    public record Binary(Expr left, BinaryOp op, SourceInfo opTok, Expr right) implements Expr {
    }

    public record CondExpr(Expr cond, Expr then, Expr otherwise) implements Expr {
    }

    public record Sequence(Expr left, SourceInfo comma, Expr right) implements Expr {
    }

    /**
     * {@code sizeof e}
     */
    public record SizeOfExpr(SourceInfo sizeofTok, Expr expr) implements Expr {
    }

    /**
     * {@code sizeof(t)}
     */
    public record SizeOfType(SourceInfo sizeofTok, Type type) implements Expr {
    }

    public interface Initializer {
    }

    public record InitExpr(Expr expr) implements Initializer {
    }

    /**
     * {@code [index] = value}
     */
    public record InitDesignated(Expr index, SourceInfo lbracket, Initializer value) implements Initializer {
    }

    public record ArrayInit(SourceInfo lbrace, List<Initializer> elements, SourceInfo rbrace) implements Expr {
    }

    public record FieldInit(Name field, Expr value) {
    }

    /**
     * {@code { .x = 1, .y = 2 }}
     */
    public record RecordInit(SourceInfo lbrace, List<FieldInit> fields, SourceInfo rbrace) implements Expr {
    }

    /**
     * GCC compound literal {@code (struct point){1, 2}}.
     */
    public record GccConstructor(SourceInfo lparen, Type type, Expr init) implements Expr {
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    public interface Stmt {
    }

    public record ExprSt(Expr expr, SourceInfo semicolon) implements Stmt {
    }

    public record Block(SourceInfo lbrace, List<Stmt> stmts, SourceInfo rbrace) implements Stmt {
    }

    /**
     * otherwise is null without else branch.
     */
    public record If(SourceInfo ifTok, Expr cond, Stmt then, Stmt otherwise) implements Stmt {
    }

    public interface CaseClause {
    }

    public record Case(SourceInfo caseTok, Expr expr, List<Stmt> body) implements CaseClause {
    }

    public record Default(SourceInfo defaultTok, List<Stmt> body) implements CaseClause {
    }

    public record Switch(SourceInfo switchTok, Expr expr, List<CaseClause> cases) implements Stmt {
    }

    public record While(SourceInfo whileTok, Expr cond, Stmt body) implements Stmt {
    }

    public record DoWhile(SourceInfo doTok, Stmt body, Expr cond) implements Stmt {
    }

    /**
     * init, cond and next are null when omitted.
     */
    public record For(SourceInfo forTok, Expr init, Expr cond, Expr next, Stmt body) implements Stmt {
    }

    /**
     * value is null for a bare return.
     */
    public record Return(SourceInfo returnTok, Expr value) implements Stmt {
    }

    public record Continue(SourceInfo info) implements Stmt {
    }

    public record Break(SourceInfo info) implements Stmt {
    }

    public record Label(Name label, Stmt body) implements Stmt {
    }

    public record Goto(SourceInfo gotoTok, Name label) implements Stmt {
    }

    public record Vars(List<VarDecl> vars) implements Stmt {
    }

    public record Asm(SourceInfo asmTok, List<Expr> parts) implements Stmt {
    }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    public enum Storage {DEFAULT, EXTERN, STATIC}

    /**
     * init is null without initializer.
     */
    public record VarDecl(Name name, Type type, Storage storage, Expr init) {
    }

    /**
     * name is null for anonymous bit fields and nested anonymous structs.
     */
    public record FieldDef(Name name, Type type) {
    }

    /**
     * body is null for a plain prototype.
     */
    public record FuncDef(Name name, Type returnType, List<Parameter> params, Storage storage, Block body) {
    }

    public record EnumConstant(Name name, Expr value) {
    }

    // ------------------------------------------------------------------
    // Toplevel
    // ------------------------------------------------------------------

    public interface Toplevel {
    }

    public record Include(SourceInfo includeTok, Name file) implements Toplevel {
    }

    /**
     * {@code #define NAME body}; body is null for a flag macro.
     */
    public record Define(Name name, Expr body) implements Toplevel {
    }

    /**
     * {@code #define NAME(a, b) body}
     */
    public record Macro(Name name, List<Name> params, Expr body) implements Toplevel {
    }

    /**
     * name is null for an anonymous struct or union.
     */
    public record StructDef(StructKind kind, SourceInfo kindTok, Name name, List<FieldDef> fields)
            implements Toplevel {
    }

    public record TypeDef(SourceInfo typedefTok, Name name, Type type) implements Toplevel {
    }

    /**
     * name is null for an anonymous enum.
     */
    public record EnumDef(SourceInfo enumTok, Name name, List<EnumConstant> constants) implements Toplevel {
    }

    public record FuncDefItem(FuncDef def) implements Toplevel {
    }

    public record Global(VarDecl var) implements Toplevel {
    }

    public record Prototype(FuncDef def) implements Toplevel {
    }

    public record Program(List<Toplevel> toplevels) {
    }
}
