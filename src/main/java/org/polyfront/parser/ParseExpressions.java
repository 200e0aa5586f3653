package org.polyfront.parser;

import org.polyfront.cst.ScalaCst.ArgBlock;
import org.polyfront.cst.ScalaCst.Args;
import org.polyfront.cst.ScalaCst.Arguments;
import org.polyfront.cst.ScalaCst.Assign;
import org.polyfront.cst.ScalaCst.BlockExpr;
import org.polyfront.cst.ScalaCst.BlockStat;
import org.polyfront.cst.ScalaCst.Call;
import org.polyfront.cst.ScalaCst.DotAccess;
import org.polyfront.cst.ScalaCst.Expr;
import org.polyfront.cst.ScalaCst.Ident;
import org.polyfront.cst.ScalaCst.If;
import org.polyfront.cst.ScalaCst.Infix;
import org.polyfront.cst.ScalaCst.InstanciatedExpr;
import org.polyfront.cst.ScalaCst.L;
import org.polyfront.cst.ScalaCst.Literal;
import org.polyfront.cst.ScalaCst.LiteralKind;
import org.polyfront.cst.ScalaCst.Name;
import org.polyfront.cst.ScalaCst.New;
import org.polyfront.cst.ScalaCst.Prefix;
import org.polyfront.cst.ScalaCst.Return;
import org.polyfront.cst.ScalaCst.S;
import org.polyfront.cst.ScalaCst.Throw;
import org.polyfront.cst.ScalaCst.Tuple;
import org.polyfront.cst.ScalaCst.Type;
import org.polyfront.cst.ScalaCst.TypedExpr;
import org.polyfront.cst.ScalaCst.While;
import org.polyfront.lexer.LexerToken;
import org.polyfront.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Expressions.
 * <p>
 * Infix operators are parsed by precedence climbing. The precedence of an
 * operator is given by its first character, lowest first:
 * <pre>
 *   (assignment operators such as +=)
 *   (all letters)
 *   |
 *   ^
 *   &amp;
 *   = !
 *   &lt; &gt;
 *   :
 *   + -
 *   * / %
 *   (all other special characters)
 * </pre>
 * Operators ending in {@code :} are right-associative.
 */
public class ParseExpressions {

    private static final Set<String> PREFIX_OPERATORS = Set.of("-", "+", "!", "~");
    private static final Set<String> TODO_KEYWORDS = Set.of("try", "for", "do", "match", "yield");

    /**
     * True when an expression can start at this token.
     */
    public static boolean isExprIntro(LexerToken t) {
        if (ScalaTokens.isLiteral(t) || ScalaTokens.isIdent(t)) {
            return true;
        }
        return switch (t.type) {
            case KEYWORD -> switch (t.text) {
                case "this", "super", "new", "if", "while", "return", "throw", "_", "try", "for", "do" -> true;
                default -> false;
            };
            case DELIMITER -> t.text.equals("(") || t.text.equals("{");
            default -> false;
        };
    }

    /**
     * <pre>
     * Expr ::= if ( Expr ) {nl} Expr [[semi] else Expr]
     *        | while ( Expr ) {nl} Expr
     *        | return [Expr]
     *        | throw Expr
     *        | [SimpleExpr .] id = Expr
     *        | PostfixExpr [: Type]
     * </pre>
     */
    public static Expr expr(ScalaParser parser) {
        TokenStream in = parser.in;
        LexerToken t = in.token;
        if (t.type == LexerTokenType.KEYWORD) {
            switch (t.text) {
                case "if" -> {
                    return ifExpr(parser);
                }
                case "while" -> {
                    LexerToken whileTok = in.accept("while");
                    Expr cond = condition(parser);
                    parser.newLinesOpt();
                    return new S(new While(whileTok.info, cond, expr(parser)));
                }
                case "return" -> {
                    LexerToken returnTok = in.accept("return");
                    Expr value = isExprIntro(in.token) ? expr(parser) : null;
                    return new S(new Return(returnTok.info, value));
                }
                case "throw" -> {
                    LexerToken throwTok = in.accept("throw");
                    return new S(new Throw(throwTok.info, expr(parser)));
                }
                default -> {
                    if (TODO_KEYWORDS.contains(t.text)) {
                        throw parser.todo(t.text);
                    }
                }
            }
        }
        Expr e = infixExpr(parser, 0);
        if (in.is("=")) {
            if (!(e instanceof Name) && !(e instanceof DotAccess) && !(e instanceof Call)) {
                throw in.error("end of expression");
            }
            LexerToken eq = in.accept("=");
            return new Assign(e, eq.info, expr(parser));
        }
        if (in.is(":")) {
            LexerToken colon = in.accept(":");
            if (in.is("_") || ScalaTokens.isAnnotation(in.token)) {
                throw parser.todo("type ascription");
            }
            Type type = ParseTypes.type(parser);
            e = new TypedExpr(e, colon.info, type);
        }
        if (in.is("match")) {
            throw parser.todo("match");
        }
        if (in.is("=>")) {
            throw parser.todo("lambda");
        }
        return e;
    }

    static Expr ifExpr(ScalaParser parser) {
        TokenStream in = parser.in;
        LexerToken ifTok = in.accept("if");
        Expr cond = condition(parser);
        parser.newLinesOpt();
        Expr then = expr(parser);
        if (in.is(";") && TokenStream.isText(in.peekNext(), "else")) {
            in.nextToken();
        }
        if (!in.is("else")) {
            return new S(new If(ifTok.info, cond, then, null, null));
        }
        LexerToken elseTok = in.accept("else");
        parser.newLinesOpt();
        Expr elseBranch = expr(parser);
        return new S(new If(ifTok.info, cond, then, elseTok.info, elseBranch));
    }

    private static Expr condition(ScalaParser parser) {
        parser.in.accept("(");
        Expr cond = expr(parser);
        parser.in.accept(")");
        return cond;
    }

    /**
     * Precedence climbing over infix operations.
     *
     * @param minPrecedence operators binding weaker than this end the operand
     */
    static Expr infixExpr(ScalaParser parser, int minPrecedence) {
        TokenStream in = parser.in;
        Expr left = prefixExpr(parser);
        while (ScalaTokens.isIdent(in.token)) {
            int precedence = precedence(in.token.text);
            if (precedence < minPrecedence) {
                break;
            }
            Ident op = parser.ident();
            parser.newLineOpt();
            if (!isExprIntro(in.token) || isStatementKeyword(in.token)) {
                throw parser.todo("postfix operator " + op.name());
            }
            boolean rightAssoc = op.name().endsWith(":");
            Expr right = infixExpr(parser, rightAssoc ? precedence : precedence + 1);
            left = new Infix(left, op, right);
        }
        return left;
    }

    private static boolean isStatementKeyword(LexerToken t) {
        return t.type == LexerTokenType.KEYWORD
                && (t.text.equals("return") || t.text.equals("while") || t.text.equals("throw"));
    }

    public static int precedence(String op) {
        if (isAssignmentOperator(op)) {
            return 0;
        }
        char c = op.charAt(0);
        if (Character.isLetter(c) || c == '_' || c == '$' || c == '`') {
            return 1;
        }
        return switch (c) {
            case '|' -> 2;
            case '^' -> 3;
            case '&' -> 4;
            case '=', '!' -> 5;
            case '<', '>' -> 6;
            case ':' -> 7;
            case '+', '-' -> 8;
            case '*', '/', '%' -> 9;
            default -> 10;
        };
    }

    static boolean isAssignmentOperator(String op) {
        return op.length() > 1 && op.endsWith("=") && !op.startsWith("=")
                && !op.equals("<=") && !op.equals(">=") && !op.equals("!=");
    }

    /**
     * {@code PrefixExpr ::= [- | + | ~ | !] SimpleExpr}
     */
    static Expr prefixExpr(ScalaParser parser) {
        TokenStream in = parser.in;
        if (in.token.type == LexerTokenType.OPERATOR && PREFIX_OPERATORS.contains(in.token.text)) {
            Ident op = parser.ident();
            return new Prefix(op, simpleExpr(parser));
        }
        return simpleExpr(parser);
    }

    /**
     * <pre>
     * SimpleExpr ::= new Type {ArgumentExprs}
     *              | BlockExpr
     *              | Literal
     *              | Path
     *              | _
     *              | ( [Exprs] )
     *              | SimpleExpr . id
     *              | SimpleExpr TypeArgs
     *              | SimpleExpr ArgumentExprs
     * </pre>
     */
    static Expr simpleExpr(ScalaParser parser) {
        TokenStream in = parser.in;
        LexerToken t = in.token;
        Expr e;
        if (ScalaTokens.isLiteral(t)) {
            in.nextToken();
            e = new L(literal(t));
        } else if (in.is("new")) {
            LexerToken newTok = in.accept("new");
            if (in.is("{")) {
                throw parser.todo("anonymous template");
            }
            Type type = ParseTypes.simpleType(parser);
            List<Arguments> arguments = new ArrayList<>();
            while (in.is("(")) {
                arguments.add(argumentExprs(parser));
            }
            if (in.is("{") || in.is("with")) {
                throw parser.todo("anonymous template");
            }
            e = new New(newTok.info, type, arguments);
        } else if (in.is("{")) {
            e = blockExpr(parser);
        } else if (in.is("(")) {
            LexerToken lparen = in.accept("(");
            List<Expr> elements = in.is(")") ? new ArrayList<>() : exprs(parser);
            LexerToken rparen = in.accept(")");
            e = new Tuple(lparen.info, elements, rparen.info);
        } else if (in.is("_")) {
            LexerToken underscore = in.accept("_");
            e = new Name(List.of(new Ident(underscore.text, underscore.info)));
        } else if (in.is("this") || in.is("super") || t.type == LexerTokenType.IDENTIFIER) {
            List<Ident> path = new ArrayList<>();
            path.add(parser.identOrThis());
            e = new Name(path);
        } else if (TODO_KEYWORDS.contains(t.text) && t.type == LexerTokenType.KEYWORD) {
            throw parser.todo(t.text);
        } else {
            throw in.error("expression");
        }
        return simpleExprRest(parser, e);
    }

    private static Expr simpleExprRest(ScalaParser parser, Expr e) {
        TokenStream in = parser.in;
        while (true) {
            if (in.is(".")) {
                LexerToken dot = in.accept(".");
                if (in.is("type")) {
                    throw parser.todo("singleton type");
                }
                Ident name = parser.identOrThis();
                if (e instanceof Name n) {
                    List<Ident> path = new ArrayList<>(n.path());
                    path.add(name);
                    e = new Name(path);
                } else {
                    e = new DotAccess(e, dot.info, name);
                }
            } else if (in.is("(") || (in.is("{") && isApplicable(e))) {
                Arguments arguments = argumentExprs(parser);
                if (e instanceof Call c) {
                    List<Arguments> all = new ArrayList<>(c.arguments());
                    all.add(arguments);
                    e = new Call(c.fn(), all);
                } else {
                    e = new Call(e, List.of(arguments));
                }
            } else if (in.is("[")) {
                LexerToken lbracket = in.accept("[");
                List<Type> types = ParseTypes.types(parser);
                LexerToken rbracket = in.accept("]");
                e = new InstanciatedExpr(e, lbracket.info, types, rbracket.info);
            } else if (in.is("_")) {
                throw parser.todo("eta expansion");
            } else {
                return e;
            }
        }
    }

    private static boolean isApplicable(Expr e) {
        return e instanceof Name || e instanceof DotAccess || e instanceof Call || e instanceof InstanciatedExpr;
    }

    /**
     * <pre>
     * ArgumentExprs ::= ( [Exprs] )
     *                 | [nl] BlockExpr
     * </pre>
     */
    public static Arguments argumentExprs(ScalaParser parser) {
        TokenStream in = parser.in;
        if (in.is("{")) {
            return new ArgBlock(blockExpr(parser));
        }
        LexerToken lparen = in.accept("(");
        List<Expr> args = in.is(")") ? new ArrayList<>() : exprs(parser);
        LexerToken rparen = in.accept(")");
        return new Args(lparen.info, args, rparen.info);
    }

    static List<Expr> exprs(ScalaParser parser) {
        List<Expr> exprs = new ArrayList<>();
        exprs.add(expr(parser));
        while (parser.in.is(",")) {
            parser.in.nextToken();
            exprs.add(expr(parser));
        }
        return exprs;
    }

    /**
     * {@code BlockExpr ::= { Block }}
     */
    public static BlockExpr blockExpr(ScalaParser parser) {
        TokenStream in = parser.in;
        LexerToken lbrace = in.accept("{");
        if (in.is("case")) {
            LexerToken next = in.peekNext();
            if (!TokenStream.isText(next, "class") && !TokenStream.isText(next, "object")) {
                throw parser.todo("case clauses");
            }
        }
        List<BlockStat> stats = StatementSequence.statSeq(parser, "start of statement", ParseDefinitions::templateStat);
        LexerToken rbrace = in.accept("}");
        return new BlockExpr(lbrace.info, stats, rbrace.info);
    }

    static Literal literal(LexerToken t) {
        LiteralKind kind = switch (t.type) {
            case INTEGER -> LiteralKind.INT;
            case FLOAT -> LiteralKind.FLOAT;
            case CHARACTER -> LiteralKind.CHAR;
            case STRING -> LiteralKind.STRING;
            default -> t.text.equals("null") ? LiteralKind.NULL : LiteralKind.BOOL;
        };
        return new Literal(kind, t.text, t.info);
    }
}
