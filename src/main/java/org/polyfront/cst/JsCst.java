package org.polyfront.cst;

import org.polyfront.lexer.SourceInfo;

import java.util.List;

/**
 * Concrete syntax tree of JavaScript (with the JSX and TypeScript-interface
 * extensions), as handed to {@code JsToGeneric}.
 * <p>
 * There is no JavaScript parser in this project; trees are built by callers.
 * Names are kept with their position as a {@link Name}. Nullable components
 * are documented on the record.
 */
public final class JsCst {

    private JsCst() {
    }

    public record Name(String name, SourceInfo info) {
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    public interface Expr {
    }

    public record Bool(boolean value, SourceInfo info) implements Expr {
    }

    public record Num(String value, SourceInfo info) implements Expr {
    }

    public record Str(String value, SourceInfo info) implements Expr {
    }

    public record Regexp(String value, SourceInfo info) implements Expr {
    }

    public record Null(SourceInfo info) implements Expr {
    }

    /**
     * An identifier reference.
     */
    public record V(Name name) implements Expr {
    }

    public record This(SourceInfo info) implements Expr {
    }

    public record Super(SourceInfo info) implements Expr {
    }

    public enum UnaryOp {
        U_NEW, U_DELETE, U_VOID, U_TYPEOF, U_BITNOT, U_NOT, U_MINUS, U_PLUS,
        U_PRE_INCR, U_PRE_DECR, U_POST_INCR, U_POST_DECR, U_SPREAD
    }

    public record Unary(UnaryOp op, SourceInfo opTok, Expr expr) implements Expr {
    }

    public enum BinaryOp {
        B_INSTANCEOF, B_IN, B_ADD, B_SUB, B_MUL, B_DIV, B_MOD, B_EXPO,
        B_LE, B_GE, B_LT, B_GT, B_LSL, B_LSR, B_ASR,
        B_EQUAL, B_NOTEQUAL, B_PHYSEQUAL, B_NOTPHYSEQUAL,
        B_BITAND, B_BITOR, B_BITXOR, B_AND, B_OR, B_NULLISH
    }

    public record Binary(Expr left, BinaryOp op, SourceInfo opTok, Expr right) implements Expr {
    }

    /**
     * {@code e.name}
     */
    public record Period(Expr expr, SourceInfo dot, Name name) implements Expr {
    }

    /**
     * {@code e[index]}
     */
    public record Bracket(Expr expr, SourceInfo lbracket, Expr index, SourceInfo rbracket) implements Expr {
    }

    public record ObjectLit(SourceInfo lbrace, List<Property> properties, SourceInfo rbrace) implements Expr {
    }

    /**
     * Elements are null for holes such as {@code [a, , b]}.
     */
    public record ArrayLit(SourceInfo lbracket, List<Expr> elements, SourceInfo rbracket) implements Expr {
    }

    public record Apply(Expr fn, SourceInfo lparen, List<Expr> args, SourceInfo rparen) implements Expr {
    }

    public record Conditional(Expr cond, Expr then, Expr otherwise) implements Expr {
    }

    /**
     * op is null for a plain {@code =}, otherwise the operator of a compound
     * assignment such as {@code +=}.
     */
    public record Assign(Expr lhs, BinaryOp op, SourceInfo opTok, Expr rhs) implements Expr {
    }

    /**
     * Assignment whose target is a pattern, as in {@code [a, b] = pair}.
     */
    public record AssignPattern(Pattern pattern, SourceInfo eq, Expr rhs) implements Expr {
    }

    public record Seq(Expr left, SourceInfo comma, Expr right) implements Expr {
    }

    public record FunctionExpr(FuncDecl decl) implements Expr {
    }

    public record ClassExpr(ClassDecl decl) implements Expr {
    }

    public record ArrowExpr(Arrow arrow) implements Expr {
    }

    public record Yield(SourceInfo yieldTok, boolean star, Expr value) implements Expr {
    }

    public record Await(SourceInfo awaitTok, Expr value) implements Expr {
    }

    public record NewTarget(SourceInfo newTok, SourceInfo dot, SourceInfo target) implements Expr {
    }

    /**
     * Template string; tag is null when untagged. Parts are string fragments
     * and interpolated expressions in order.
     */
    public record Encaps(Expr tag, SourceInfo backquote, List<Expr> parts) implements Expr {
    }

    public record XmlExpr(Xml xml) implements Expr {
    }

    public record Paren(SourceInfo lparen, Expr expr, SourceInfo rparen) implements Expr {
    }

    // ------------------------------------------------------------------
    // Object literals and classes
    // ------------------------------------------------------------------

    public interface PropertyName {
    }

    public record PnId(Name name) implements PropertyName {
    }

    public record PnString(Name value) implements PropertyName {
    }

    public record PnNum(Name value) implements PropertyName {
    }

    public record PnComputed(SourceInfo lbracket, Expr expr, SourceInfo rbracket) implements PropertyName {
    }

    public interface Property {
    }

    public record PField(PropertyName name, Expr value) implements Property {
    }

    public record PMethod(FuncDecl decl) implements Property {
    }

    public record PShorthand(Name name) implements Property {
    }

    public record PSpread(SourceInfo dots, Expr expr) implements Property {
    }

    public record ClassDecl(SourceInfo classTok, Name name, Expr extendsExpr, List<ClassElement> body) {
    }

    public interface ClassElement {
    }

    /**
     * staticTok is null for instance members; value is null without initializer.
     */
    public record CField(SourceInfo staticTok, PropertyName name, Expr value) implements ClassElement {
    }

    public record CMethod(SourceInfo staticTok, FuncDecl decl) implements ClassElement {
    }

    public record CExtraSemicolon(SourceInfo info) implements ClassElement {
    }

    // ------------------------------------------------------------------
    // Functions
    // ------------------------------------------------------------------

    public enum FuncKind {F_FUNC, F_METHOD, F_GET, F_SET}

    /**
     * name is null for anonymous functions; generatorTok and asyncTok are
     * null when the marker is absent.
     */
    public record FuncDecl(FuncKind kind, SourceInfo kindTok, PropertyName name, SourceInfo generatorTok,
                           SourceInfo asyncTok, List<Param> params, List<Item> body) {
    }

    public interface Param {
    }

    /**
     * defaultValue is null without default.
     */
    public record ParamClassic(Name name, Expr defaultValue) implements Param {
    }

    public record ParamPattern(Pattern pattern, Expr defaultValue) implements Param {
    }

    public record ParamEllipsis(SourceInfo dots, Name name) implements Param {
    }

    public interface ArrowBody {
    }

    public record ArrowExprBody(Expr expr) implements ArrowBody {
    }

    public record ArrowBlockBody(SourceInfo lbrace, List<Item> items, SourceInfo rbrace) implements ArrowBody {
    }

    public record Arrow(SourceInfo asyncTok, List<Param> params, SourceInfo arrow, ArrowBody body) {
    }

    // ------------------------------------------------------------------
    // JSX
    // ------------------------------------------------------------------

    public interface XmlAttr {
    }

    public record XmlAttrValue(Name name, Expr value) implements XmlAttr {
    }

    public record XmlAttrSpread(SourceInfo dots, Expr expr) implements XmlAttr {
    }

    public interface XmlBody {
    }

    public record XmlText(Name text) implements XmlBody {
    }

    public record XmlExprBody(Expr expr) implements XmlBody {
    }

    public record XmlChild(Xml xml) implements XmlBody {
    }

    /**
     * tag is null for a fragment {@code <>...</>}.
     */
    public record Xml(Name tag, List<XmlAttr> attrs, List<XmlBody> body) {
    }

    // ------------------------------------------------------------------
    // Patterns
    // ------------------------------------------------------------------

    public interface Pattern {
    }

    public record PatObj(SourceInfo lbrace, List<PatternProperty> properties, SourceInfo rbrace)
            implements Pattern {
    }

    /**
     * Elements are null for holes.
     */
    public record PatArr(SourceInfo lbracket, List<PatternProperty> elements, SourceInfo rbracket)
            implements Pattern {
    }

    public interface PatternProperty {
    }

    /**
     * {@code x} or {@code x = default}; defaultValue is null without default.
     */
    public record PatId(Name name, Expr defaultValue) implements PatternProperty {
    }

    /**
     * {@code key: pattern}
     */
    public record PatProp(PropertyName name, PatternProperty value) implements PatternProperty {
    }

    public record PatDots(SourceInfo dots, Name name) implements PatternProperty {
    }

    public record PatNest(Pattern pattern, Expr defaultValue) implements PatternProperty {
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    public enum VarKind {VAR, LET, CONST}

    public interface VarBinding {
    }

    /**
     * init is null without initializer.
     */
    public record VarClassic(Name name, Expr init) implements VarBinding {
    }

    public record VarPattern(Pattern pattern, Expr init) implements VarBinding {
    }

    public interface Stmt {
    }

    public record VarsDecl(VarKind kind, SourceInfo kindTok, List<VarBinding> bindings) implements Stmt {
    }

    public record Block(SourceInfo lbrace, List<Item> items, SourceInfo rbrace) implements Stmt {
    }

    public record Nop(SourceInfo info) implements Stmt {
    }

    public record ExprStmt(Expr expr, SourceInfo semicolon) implements Stmt {
    }

    /**
     * otherwise is null without else branch.
     */
    public record If(SourceInfo ifTok, Expr cond, Stmt then, Stmt otherwise) implements Stmt {
    }

    public record Do(SourceInfo doTok, Stmt body, Expr cond) implements Stmt {
    }

    public record While(SourceInfo whileTok, Expr cond, Stmt body) implements Stmt {
    }

    public interface ForInit {
    }

    public record ForInitVars(VarsDecl decl) implements ForInit {
    }

    public record ForInitExpr(Expr expr) implements ForInit {
    }

    /**
     * init, cond and next are null when omitted.
     */
    public record For(SourceInfo forTok, ForInit init, Expr cond, Expr next, Stmt body) implements Stmt {
    }

    /**
     * The left-hand side of a for-in or for-of: a declaration of one binding,
     * or an assignable expression.
     */
    public interface ForLhs {
    }

    public record ForLhsVar(VarKind kind, SourceInfo kindTok, VarBinding binding) implements ForLhs {
    }

    public record ForLhsExpr(Expr expr) implements ForLhs {
    }

    public record ForIn(SourceInfo forTok, ForLhs lhs, SourceInfo inTok, Expr collection, Stmt body)
            implements Stmt {
    }

    public record ForOf(SourceInfo forTok, ForLhs lhs, SourceInfo ofTok, Expr collection, Stmt body)
            implements Stmt {
    }

    public interface CaseClause {
    }

    public record Case(SourceInfo caseTok, Expr expr, List<Item> body) implements CaseClause {
    }

    public record Default(SourceInfo defaultTok, List<Item> body) implements CaseClause {
    }

    public record Switch(SourceInfo switchTok, Expr discriminant, List<CaseClause> cases) implements Stmt {
    }

    /**
     * label is null for an unlabeled continue.
     */
    public record Continue(SourceInfo continueTok, Name label) implements Stmt {
    }

    public record Break(SourceInfo breakTok, Name label) implements Stmt {
    }

    /**
     * value is null for a bare return.
     */
    public record Return(SourceInfo returnTok, Expr value) implements Stmt {
    }

    public record With(SourceInfo withTok, Expr object, Stmt body) implements Stmt {
    }

    public record Labeled(Name label, Stmt body) implements Stmt {
    }

    public record Throw(SourceInfo throwTok, Expr value) implements Stmt {
    }

    /**
     * catchName is null for {@code catch {}} and when there is no catch;
     * catchBody and finallyBody are null when absent.
     */
    public record Try(SourceInfo tryTok, Stmt body, SourceInfo catchTok, Name catchName, Stmt catchBody,
                      SourceInfo finallyTok, Stmt finallyBody) implements Stmt {
    }

    // ------------------------------------------------------------------
    // Items and modules
    // ------------------------------------------------------------------

    public interface Item {
    }

    public record St(Stmt stmt) implements Item {
    }

    public record FunDecl(FuncDecl decl) implements Item {
    }

    public record ClassItem(ClassDecl decl) implements Item {
    }

    public record InterfaceDecl(SourceInfo interfaceTok, Name name) implements Item {
    }

    public record ItemTodo(String category, SourceInfo info) implements Item {
    }

    public interface ModuleItem {
    }

    public record It(Item item) implements ModuleItem {
    }

    public record ImportItem(SourceInfo importTok, ImportDecl decl) implements ModuleItem {
    }

    public record ExportItem(SourceInfo exportTok, ExportDecl decl) implements ModuleItem {
    }

    public interface ImportDecl {
    }

    /**
     * {@code import "path";}
     */
    public record ImportEffect(Name path) implements ImportDecl {
    }

    /**
     * {@code import default, <clause> from "path"}; defaultName and clause are
     * null when absent.
     */
    public record ImportFrom(Name defaultName, ImportClause clause, Name path) implements ImportDecl {
    }

    public interface ImportClause {
    }

    public record ImportNamespace(SourceInfo star, Name alias) implements ImportClause {
    }

    public record ImportNames(List<NameAlias> names) implements ImportClause {
    }

    /**
     * {@code import type {...}}, dropped by lowering.
     */
    public record ImportTypes(List<NameAlias> names) implements ImportClause {
    }

    /**
     * {@code name as alias}; alias is null without rename.
     */
    public record NameAlias(Name name, Name alias) {
    }

    public interface ExportDecl {
    }

    public record ExportDefaultExpr(SourceInfo defaultTok, Expr expr) implements ExportDecl {
    }

    /**
     * {@code export var|let|const|function|class ...}
     */
    public record ExportDeclaration(Item item) implements ExportDecl {
    }

    /**
     * {@code export default function|class ...}, possibly anonymous.
     */
    public record ExportDefaultDecl(SourceInfo defaultTok, Item item) implements ExportDecl {
    }

    public record ExportNames(List<NameAlias> names) implements ExportDecl {
    }

    public record ReExportNames(List<NameAlias> names, Name path) implements ExportDecl {
    }

    /**
     * {@code export * from "path"}
     */
    public record ReExportNamespace(SourceInfo star, Name path) implements ExportDecl {
    }

    public record Program(List<ModuleItem> items) {
    }
}
