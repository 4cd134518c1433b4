package com.checkpilot.orchestrator.resource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.checkpilot.orchestrator.resource.ResourceProgramException.Kind.CODE_NOT_ALLOWED;
import static com.checkpilot.orchestrator.resource.ResourceProgramException.Kind.SYNTAX;

/**
 * Recursive-descent parser for one requirement expression.
 *
 * <pre>
 * expr       := or
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | comparison
 * comparison := arith (cmp_op arith)*
 * arith      := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '//' | '%') unary)*
 * unary      := ('-' | '+') unary | postfix
 * postfix    := atom ('.' NAME | '(' expr ')')*
 * atom       := NAME | NUMBER | STRING | 'True' | 'False' | 'None'
 *             | '(' [expr (',' expr)* [','] ] ')' | '[' [expr (',' expr)* [','] ] ']'
 * </pre>
 *
 * Constructs outside this grammar that are still valid in the general
 * language ({@code not in}, {@code is}, subscripts, lambdas, conditional
 * expressions, comprehensions, arbitrary calls) are rejected as
 * {@code CODE_NOT_ALLOWED} rather than {@code SYNTAX}.
 */
final class ExpressionParser {

    private static final Set<String> ALLOWED_CALLS = Set.of("int", "float", "bool");

    private static final Set<String> FORBIDDEN_KEYWORDS = Set.of(
            "is", "if", "else", "for", "lambda", "yield", "await", "async", "import",
            "from", "def", "class", "return", "del", "global", "nonlocal", "assert",
            "with", "while", "try", "except", "finally", "raise", "pass", "break", "continue");

    private final String text;
    private final List<Token> tokens;
    private int pos = 0;

    private ExpressionParser(String text) {
        this.text   = text;
        this.tokens = Tokenizer.tokenize(text);
    }

    static Node parse(String text) {
        ExpressionParser parser = new ExpressionParser(text);
        Node node = parser.expression();
        Token t = parser.peek();
        if (t.type() != Token.Type.END) {
            throw parser.unexpected(t);
        }
        return node;
    }

    // -------------------------------------------------------------------------

    private Node expression() {
        return or();
    }

    private Node or() {
        Node first = and();
        if (!peek().isKeyword("or")) return first;
        List<Node> operands = new ArrayList<>(List.of(first));
        while (peek().isKeyword("or")) {
            next();
            operands.add(and());
        }
        return new Node.BoolOp(false, operands);
    }

    private Node and() {
        Node first = not();
        if (!peek().isKeyword("and")) return first;
        List<Node> operands = new ArrayList<>(List.of(first));
        while (peek().isKeyword("and")) {
            next();
            operands.add(not());
        }
        return new Node.BoolOp(true, operands);
    }

    private Node not() {
        if (peek().isKeyword("not")) {
            next();
            return new Node.Not(not());
        }
        return comparison();
    }

    private Node comparison() {
        Node first = arith();
        List<String> ops = new ArrayList<>();
        List<Node> rest  = new ArrayList<>();
        while (true) {
            Token t = peek();
            String op = null;
            if (t.type() == Token.Type.OPERATOR
                    && Set.of("==", "!=", "<", "<=", ">", ">=").contains(t.text())) {
                op = t.text();
            } else if (t.isKeyword("in")) {
                op = "in";
            } else if (t.isKeyword("not") && peekAt(1).isKeyword("in")) {
                throw notAllowed("'not in' is not allowed, use 'not (... in ...)'");
            } else if (t.isKeyword("is")) {
                throw notAllowed("'is' comparisons are not allowed");
            }
            if (op == null) break;
            next();
            ops.add(op);
            rest.add(arith());
        }
        return ops.isEmpty() ? first : new Node.Compare(first, ops, rest);
    }

    private Node arith() {
        Node left = term();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            String op = next().text();
            left = new Node.BinaryOp(op, left, term());
        }
        return left;
    }

    private Node term() {
        Node left = unary();
        while (peek().isOperator("*") || peek().isOperator("/")
                || peek().isOperator("//") || peek().isOperator("%")) {
            String op = next().text();
            left = new Node.BinaryOp(op, left, unary());
        }
        return left;
    }

    private Node unary() {
        if (peek().isOperator("-") || peek().isOperator("+")) {
            String op = next().text();
            return new Node.UnaryOp(op, unary());
        }
        return postfix();
    }

    private Node postfix() {
        Node node = atom();
        while (true) {
            Token t = peek();
            if (t.isOperator(".")) {
                next();
                Token name = next();
                if (name.type() != Token.Type.NAME) {
                    throw syntax("attribute name expected at " + name.position());
                }
                node = new Node.AttributeRef(node, name.text());
            } else if (t.isOperator("(")) {
                node = call(node);
            } else if (t.isOperator("[")) {
                throw notAllowed("subscripts are not allowed");
            } else {
                return node;
            }
        }
    }

    private Node call(Node callee) {
        if (!(callee instanceof Node.NameRef ref) || !ALLOWED_CALLS.contains(ref.name())) {
            throw notAllowed("only int(), float() and bool() may be called");
        }
        next();
        List<Node> args = new ArrayList<>();
        if (!peek().isOperator(")")) {
            args.add(expression());
            while (peek().isOperator(",")) {
                next();
                if (peek().isOperator(")")) break;
                args.add(expression());
            }
        }
        expect(")");
        if (args.size() != 1) {
            throw notAllowed(ref.name() + "() takes exactly one argument");
        }
        return new Node.Call(ref.name(), args.get(0));
    }

    private Node atom() {
        Token t = next();
        switch (t.type()) {
            case NUMBER:
                return new Node.Literal(number(t.text()));
            case STRING: {
                StringBuilder sb = new StringBuilder(t.text());
                while (peek().type() == Token.Type.STRING) {
                    sb.append(next().text());
                }
                return new Node.Literal(sb.toString());
            }
            case NAME:
                return switch (t.text()) {
                    case "True"  -> new Node.Literal(Boolean.TRUE);
                    case "False" -> new Node.Literal(Boolean.FALSE);
                    case "None"  -> new Node.Literal(null);
                    case "and", "or", "not", "in" -> throw unexpected(t);
                    default -> {
                        if (FORBIDDEN_KEYWORDS.contains(t.text())) {
                            throw notAllowed("'" + t.text() + "' is not allowed");
                        }
                        yield new Node.NameRef(t.text());
                    }
                };
            case OPERATOR:
                if (t.text().equals("(")) return sequence(")", true);
                if (t.text().equals("[")) return sequence("]", false);
                throw unexpected(t);
            default:
                throw syntax("unexpected end of expression");
        }
    }

    /** Parenthesised expression, tuple or list literal. */
    private Node sequence(String close, boolean parenthesised) {
        List<Node> items = new ArrayList<>();
        boolean trailingComma = false;
        while (!peek().isOperator(close)) {
            items.add(expression());
            if (peek().isKeyword("for")) {
                throw notAllowed("comprehensions are not allowed");
            }
            trailingComma = false;
            if (peek().isOperator(",")) {
                next();
                trailingComma = true;
            } else {
                break;
            }
        }
        expect(close);
        if (parenthesised && items.size() == 1 && !trailingComma) {
            return items.get(0);
        }
        if (parenthesised && items.isEmpty()) {
            return new Node.ListLiteral(List.of());
        }
        return new Node.ListLiteral(List.copyOf(items));
    }

    private Object number(String literal) {
        try {
            if (literal.contains(".") || literal.contains("e") || literal.contains("E")) {
                return Double.parseDouble(literal);
            }
            return Long.parseLong(literal);
        } catch (NumberFormatException e) {
            throw syntax("invalid number literal '" + literal + "'");
        }
    }

    // -------------------------------------------------------------------------

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != Token.Type.END) pos++;
        return t;
    }

    private void expect(String operator) {
        Token t = next();
        if (!t.isOperator(operator)) {
            throw syntax("expected '" + operator + "' at " + t.position());
        }
    }

    private ResourceProgramException unexpected(Token t) {
        if (t.type() == Token.Type.NAME && FORBIDDEN_KEYWORDS.contains(t.text())) {
            return notAllowed("'" + t.text() + "' is not allowed");
        }
        if (t.type() == Token.Type.END) {
            return syntax("unexpected end of expression");
        }
        return syntax("unexpected '" + t.text() + "' at " + t.position());
    }

    private ResourceProgramException syntax(String message) {
        return new ResourceProgramException(SYNTAX, text, message);
    }

    private ResourceProgramException notAllowed(String message) {
        return new ResourceProgramException(CODE_NOT_ALLOWED, text, message);
    }
}
