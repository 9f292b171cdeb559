package com.initialone.jqport.ast;

import com.initialone.jqport.model.ScriptParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the subset of Python that strategy scripts use.
 *
 * <p>Statements are parsed fully (blocks, decorators, assignments, imports). Expressions are parsed
 * into primaries (names, literals, bracket groups with attribute / call / subscript trailers)
 * separated by operator tokens; operator precedence is not modelled because no rewrite depends on it.
 * Comments and blank lines are kept as statements so the printed output stays readable.
 */
public final class ScriptParser {

    private static final Set<String> COMPOUND_KEYWORDS = Set.of(
            "if", "elif", "else", "for", "while", "try", "except", "finally", "with");

    private static final Set<String> SIMPLE_KEYWORDS = Set.of(
            "return", "pass", "break", "continue", "raise", "global", "nonlocal", "del", "assert",
            "import", "from");

    private static final Set<String> NO_ARGUMENT_KEYWORDS = Set.of("pass", "break", "continue");

    /** 在表达式里作为运算符出现的关键字 */
    private static final Set<String> OPERATOR_KEYWORDS = Set.of(
            "and", "or", "not", "in", "is", "if", "else", "for", "lambda", "yield", "from", "import", "as");

    /** 超出支持子集的关键字 */
    private static final Set<String> UNSUPPORTED_KEYWORDS = Set.of("async", "await");

    private static final Set<String> ASSIGN_OPS = Set.of(
            "=", "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

    private final List<Token> tokens;
    private int pos;
    private final List<String> comments = new ArrayList<>();

    private ScriptParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a complete script.
     *
     * @throws ScriptParseException when the text is not valid in the supported subset
     */
    public static SyntaxTree parse(String text) throws ScriptParseException {
        String normalized = text.startsWith("﻿") ? text.substring(1) : text;
        List<Token> tokens = new ScriptLexer(normalized).tokenize();
        ScriptParser p = new ScriptParser(tokens);
        List<Node> body = p.block();
        Token end = p.peekRaw();
        if (end.type != Token.Type.EOF) {
            throw p.error("unexpected " + describe(end), end);
        }
        return new SyntaxTree(Node.module(body), normalized.split("\r\n|\r|\n", -1).length);
    }

    /* ======================= 语句 ======================= */

    private List<Node> block() throws ScriptParseException {
        List<Node> body = new ArrayList<>();
        while (true) {
            Token t = peekRaw();
            switch (t.type) {
                case EOF:
                case DEDENT:
                    return body;
                case COMMENT_LINE:
                    pos++;
                    body.add(Node.comment(t.line, t.text));
                    break;
                case BLANK_LINE:
                    pos++;
                    body.add(Node.blank(t.line));
                    break;
                case NEWLINE:
                    pos++;
                    break;
                case INDENT:
                    throw error("unexpected indent", t);
                default:
                    body.addAll(statement());
            }
        }
    }

    private List<Node> statement() throws ScriptParseException {
        comments.clear();
        Token t = peek();
        if (t.isOp("@")) {
            return List.of(decorated());
        }
        if (t.type == Token.Type.NAME) {
            if (UNSUPPORTED_KEYWORDS.contains(t.text)) {
                throw error("'" + t.text + "' is not supported in strategy scripts", t);
            }
            if (t.text.equals("def")) return List.of(functionDef(List.of()));
            if (t.text.equals("class")) return List.of(classDef(List.of()));
            if (COMPOUND_KEYWORDS.contains(t.text)) return List.of(compound());
        }
        return simpleLine();
    }

    private Node decorated() throws ScriptParseException {
        List<Node> decorators = new ArrayList<>();
        while (peek().isOp("@")) {
            next();
            decorators.add(sequence(false, false));
            expectNewline();
            skipLayout();
        }
        Token t = peek();
        if (t.is(Token.Type.NAME, "def")) return functionDef(decorators);
        if (t.is(Token.Type.NAME, "class")) return classDef(decorators);
        throw error("decorator must be followed by def or class", t);
    }

    private Node functionDef(List<Node> decorators) throws ScriptParseException {
        Token kw = next();
        Token name = expect(Token.Type.NAME, "function name");
        expectOp("(");
        List<Node> params = new ArrayList<>(argList(")"));
        expectOp(")");
        if (peek().isOp("->")) {
            next();
            params.add(sequence(false, true));
        }
        expectOp(":");
        String comment = takeComments();
        List<Node> body = suite();
        return Node.functionDef(kw.line, name.text, params, body, decorators).withComment(comment);
    }

    private Node classDef(List<Node> decorators) throws ScriptParseException {
        Token kw = next();
        Token name = expect(Token.Type.NAME, "class name");
        List<Node> bases = List.of();
        if (peek().isOp("(")) {
            next();
            bases = argList(")");
            expectOp(")");
        }
        expectOp(":");
        String comment = takeComments();
        List<Node> body = suite();
        return Node.classDef(kw.line, name.text, bases, body, decorators).withComment(comment);
    }

    private Node compound() throws ScriptParseException {
        Token kw = next();
        Node header = null;
        if (!peek().isOp(":")) {
            header = sequence(false, true);
            if (header.children().isEmpty()) header = null;
        }
        expectOp(":");
        String comment = takeComments();
        List<Node> body = suite();
        return Node.compound(kw.line, kw.text, header, body).withComment(comment);
    }

    private List<Node> suite() throws ScriptParseException {
        Token t = peek();
        if (t.type == Token.Type.NEWLINE) {
            next();
            Token indent = peekRaw();
            if (indent.type != Token.Type.INDENT) {
                throw error("expected an indented block", indent);
            }
            pos++;
            List<Node> body = block();
            Token end = peekRaw();
            if (end.type == Token.Type.DEDENT) pos++;
            return body;
        }
        // 同一行的简单语句体：if x: return
        return simpleLine();
    }

    private List<Node> simpleLine() throws ScriptParseException {
        List<Node> out = new ArrayList<>();
        while (true) {
            out.add(smallStatement());
            if (peek().isOp(";")) {
                next();
                Token t = peek();
                if (t.type == Token.Type.NEWLINE || t.type == Token.Type.EOF) break;
                continue;
            }
            break;
        }
        expectNewline();
        String comment = takeComments();
        if (comment != null) {
            int last = out.size() - 1;
            out.set(last, out.get(last).withComment(comment));
        }
        return out;
    }

    private Node smallStatement() throws ScriptParseException {
        Token t = peek();
        if (t.type == Token.Type.NAME && SIMPLE_KEYWORDS.contains(t.text)) {
            next();
            if (NO_ARGUMENT_KEYWORDS.contains(t.text) || atStatementEnd()) {
                return Node.simpleStmt(t.line, t.text, null);
            }
            return Node.simpleStmt(t.line, t.text, sequence(false, false));
        }
        if (t.type == Token.Type.NAME && UNSUPPORTED_KEYWORDS.contains(t.text)) {
            throw error("'" + t.text + "' is not supported in strategy scripts", t);
        }
        if (t.type == Token.Type.NAME && (t.text.equals("def") || t.text.equals("class")
                || COMPOUND_KEYWORDS.contains(t.text))) {
            throw error("compound statement '" + t.text + "' must start on its own line", t);
        }
        Node seq = sequence(false, false);
        if (seq.children().isEmpty()) {
            throw error("invalid syntax near " + describe(peek()), peek());
        }
        return splitAssignment(t.line, seq);
    }

    /** a = b = f(x) / x += 1 ；lambda 默认参数里的 '=' 不算赋值 */
    private Node splitAssignment(int line, Node seq) {
        List<List<Node>> parts = new ArrayList<>();
        List<Node> current = new ArrayList<>();
        String op = null;
        boolean inLambda = false;
        for (Node piece : seq.children()) {
            if (piece.is(Node.Kind.OPERATOR) && piece.text().equals("lambda")) inLambda = true;
            if (!inLambda && piece.is(Node.Kind.OPERATOR) && ASSIGN_OPS.contains(piece.text())
                    && (op == null || op.equals("=") && piece.text().equals("="))) {
                op = piece.text();
                parts.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(piece);
        }
        if (op == null) {
            return Node.exprStmt(line, seq);
        }
        parts.add(current);
        List<Node> seqs = new ArrayList<>();
        for (List<Node> p : parts) {
            List<Node> pieces = new ArrayList<>(p);
            if (!pieces.isEmpty()) pieces.set(0, pieces.get(0).withSpaceBefore(false));
            seqs.add(Node.sequence(pieces, false));
        }
        return Node.assign(line, op, seqs);
    }

    /* ======================= 表达式 ======================= */

    /**
     * Operands and operators up to the end of the current expression.
     *
     * @param inGroup     stop at ',' (inside brackets)
     * @param stopAtColon stop at a top-level ':' (compound statement headers)
     */
    private Node sequence(boolean inGroup, boolean stopAtColon) throws ScriptParseException {
        List<Node> pieces = new ArrayList<>();
        Token first = peek();
        while (true) {
            Token t = peek();
            if (t.type == Token.Type.NEWLINE || t.type == Token.Type.EOF
                    || t.type == Token.Type.INDENT || t.type == Token.Type.DEDENT) break;
            if (t.type == Token.Type.OP) {
                String op = t.text;
                if (op.equals(")") || op.equals("]") || op.equals("}")) break;
                if (inGroup && op.equals(",")) break;
                if (!inGroup && op.equals(";")) break;
                if (stopAtColon && op.equals(":")) break;
                if (op.equals("(") || op.equals("[") || op.equals("{")) {
                    pieces.add(primary());
                } else {
                    next();
                    pieces.add(Node.operator(op, t.spaceBefore));
                }
                continue;
            }
            if (t.type == Token.Type.NAME) {
                if (UNSUPPORTED_KEYWORDS.contains(t.text)) {
                    throw error("'" + t.text + "' is not supported in strategy scripts", t);
                }
                if (OPERATOR_KEYWORDS.contains(t.text)) {
                    next();
                    pieces.add(Node.operator(t.text, t.spaceBefore));
                    continue;
                }
                pieces.add(primary());
                continue;
            }
            if (t.type == Token.Type.NUMBER || t.type == Token.Type.STRING) {
                pieces.add(primary());
                continue;
            }
            throw error("unexpected " + describe(t), t);
        }
        return Node.sequence(pieces, first.spaceBefore);
    }

    private Node primary() throws ScriptParseException {
        Token t = next();
        Node cur;
        switch (t.type) {
            case NAME:
                cur = Node.name(t.text, t.spaceBefore);
                break;
            case NUMBER:
            case STRING:
                cur = Node.literal(t.text, t.spaceBefore);
                break;
            case OP:
                cur = group(t);
                break;
            default:
                throw error("unexpected " + describe(t), t);
        }
        while (true) {
            Token n = peek();
            if (n.isOp(".") && peek(1).type == Token.Type.NAME) {
                next();
                cur = Node.attribute(cur, next().text);
            } else if (n.isOp("(")) {
                next();
                List<Node> args = argList(")");
                boolean trailing = lastSeparatorWasComma;
                expectOp(")");
                cur = Node.call(cur, args, trailing);
            } else if (n.isOp("[")) {
                Token open = next();
                cur = Node.subscript(cur, group(open));
            } else {
                return cur;
            }
        }
    }

    private boolean lastSeparatorWasComma;

    private Node group(Token open) throws ScriptParseException {
        String close = open.text.equals("(") ? ")" : open.text.equals("[") ? "]" : "}";
        List<Node> elements = new ArrayList<>();
        boolean trailing = false;
        while (!peek().isOp(close)) {
            Node element = sequence(true, false);
            if (element.children().isEmpty()) {
                throw error("invalid syntax near " + describe(peek()), peek());
            }
            elements.add(element);
            if (peek().isOp(",")) {
                next();
                trailing = true;
            } else {
                trailing = false;
                break;
            }
        }
        expectOp(close);
        return Node.group(open.text, elements, trailing && !elements.isEmpty(), open.spaceBefore);
    }

    /** Call arguments / def parameters / class bases: positional and keyword=value entries. */
    private List<Node> argList(String close) throws ScriptParseException {
        List<Node> args = new ArrayList<>();
        lastSeparatorWasComma = false;
        while (!peek().isOp(close)) {
            String keyword = null;
            if (peek().type == Token.Type.NAME && peek(1).isOp("=")
                    && !OPERATOR_KEYWORDS.contains(peek().text)) {
                keyword = next().text;
                next();
            }
            Node value = sequence(true, false);
            if (value.children().isEmpty()) {
                throw error("invalid syntax near " + describe(peek()), peek());
            }
            args.add(Node.arg(keyword, value));
            if (peek().isOp(",")) {
                next();
                lastSeparatorWasComma = true;
            } else {
                lastSeparatorWasComma = false;
                break;
            }
        }
        boolean trailing = lastSeparatorWasComma && !args.isEmpty();
        lastSeparatorWasComma = trailing;
        return args;
    }

    /* ======================= token 工具 ======================= */

    private Token peekRaw() {
        return tokens.get(Math.min(pos, tokens.size() - 1));
    }

    /** 跳过行尾/括号内注释（收集起来挂到当前语句上） */
    private Token peek() {
        while (pos < tokens.size() && tokens.get(pos).type == Token.Type.COMMENT) {
            comments.add(tokens.get(pos).text);
            pos++;
        }
        return peekRaw();
    }

    private Token peek(int ahead) {
        peek();
        int p = pos;
        int seen = 0;
        while (p < tokens.size()) {
            Token t = tokens.get(p);
            if (t.type != Token.Type.COMMENT) {
                if (seen == ahead) return t;
                seen++;
            }
            p++;
        }
        return tokens.get(tokens.size() - 1);
    }

    private Token next() {
        Token t = peek();
        if (pos < tokens.size() - 1) pos++;
        return t;
    }

    private boolean atStatementEnd() {
        Token t = peek();
        return t.type == Token.Type.NEWLINE || t.type == Token.Type.EOF || t.isOp(";");
    }

    private void skipLayout() {
        while (true) {
            Token t = peekRaw();
            if (t.type == Token.Type.BLANK_LINE || t.type == Token.Type.COMMENT_LINE || t.type == Token.Type.NEWLINE) {
                pos++;
            } else {
                return;
            }
        }
    }

    private Token expect(Token.Type type, String what) throws ScriptParseException {
        Token t = peek();
        if (t.type != type) throw error("expected " + what + " but found " + describe(t), t);
        return next();
    }

    private void expectOp(String op) throws ScriptParseException {
        Token t = peek();
        if (!t.isOp(op)) throw error("expected '" + op + "' but found " + describe(t), t);
        next();
    }

    private void expectNewline() throws ScriptParseException {
        Token t = peek();
        if (t.type == Token.Type.NEWLINE) {
            next();
            return;
        }
        if (t.type == Token.Type.EOF || t.type == Token.Type.DEDENT) return;
        throw error("invalid syntax near " + describe(t), t);
    }

    private String takeComments() {
        peek();
        if (comments.isEmpty()) return null;
        String joined = String.join("  ", comments);
        comments.clear();
        return joined;
    }

    private ScriptParseException error(String message, Token t) {
        return new ScriptParseException(message, t.line, Math.max(1, t.column));
    }

    private static String describe(Token t) {
        switch (t.type) {
            case NEWLINE:
                return "end of line";
            case EOF:
                return "end of file";
            case INDENT:
                return "indent";
            case DEDENT:
                return "dedent";
            default:
                return "'" + t.text + "'";
        }
    }
}
