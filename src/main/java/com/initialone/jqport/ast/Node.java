package com.initialone.jqport.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable syntax-tree node. The tree uses one class for every node and a closed {@link Kind}
 * enumeration; code that walks the tree dispatches on the kind.
 *
 * <p>Field usage per kind:
 * <pre>
 *   MODULE        body
 *   FUNCTION_DEF  text=name, children=ARG params [+ SEQUENCE return annotation], body, decorators
 *   CLASS_DEF     text=name, children=ARG bases, body, decorators
 *   COMPOUND      text=keyword (if/elif/else/for/while/try/except/finally/with), children=[header], body
 *   ASSIGN        text=operator, children=targets... + value (last)
 *   EXPR_STMT     children=[SEQUENCE]
 *   SIMPLE_STMT   text=keyword (return/pass/import/from/global/...), children=[SEQUENCE] or empty
 *   COMMENT       text=comment including '#'
 *   BLANK         -
 *   SEQUENCE      children=operands and operators, in source order
 *   NAME / LITERAL / OPERATOR   text
 *   ATTRIBUTE     children=[value], text=attribute name
 *   CALL          children=[callee, ARG...]
 *   ARG           text=keyword or null, children=[SEQUENCE]
 *   SUBSCRIPT     children=[value, GROUP]
 *   GROUP         text=open bracket, children=element SEQUENCEs
 * </pre>
 */
public final class Node {

    public enum Kind {
        MODULE, FUNCTION_DEF, CLASS_DEF, COMPOUND, ASSIGN, EXPR_STMT, SIMPLE_STMT, COMMENT, BLANK,
        SEQUENCE, NAME, LITERAL, OPERATOR, ATTRIBUTE, CALL, ARG, SUBSCRIPT, GROUP
    }

    private final Kind kind;
    private final int line;
    private final String text;
    private final List<Node> children;
    private final List<Node> body;
    private final List<Node> decorators;
    private final boolean spaceBefore;
    private final boolean trailingComma;
    private final String comment;

    private Node(Kind kind, int line, String text, List<Node> children, List<Node> body, List<Node> decorators,
                 boolean spaceBefore, boolean trailingComma, String comment) {
        this.kind = Objects.requireNonNull(kind);
        this.line = line;
        this.text = text;
        this.children = freeze(children);
        this.body = freeze(body);
        this.decorators = freeze(decorators);
        this.spaceBefore = spaceBefore;
        this.trailingComma = trailingComma;
        this.comment = comment;
    }

    private static List<Node> freeze(List<Node> in) {
        return in == null || in.isEmpty() ? List.of() : Collections.unmodifiableList(new ArrayList<>(in));
    }

    /* ======================= 工厂方法 ======================= */

    public static Node module(List<Node> body) {
        return new Node(Kind.MODULE, 0, null, null, body, null, false, false, null);
    }

    public static Node functionDef(int line, String name, List<Node> params, List<Node> body, List<Node> decorators) {
        return new Node(Kind.FUNCTION_DEF, line, name, params, body, decorators, false, false, null);
    }

    public static Node classDef(int line, String name, List<Node> bases, List<Node> body, List<Node> decorators) {
        return new Node(Kind.CLASS_DEF, line, name, bases, body, decorators, false, false, null);
    }

    public static Node compound(int line, String keyword, Node header, List<Node> body) {
        return new Node(Kind.COMPOUND, line, keyword, header == null ? null : List.of(header), body, null,
                false, false, null);
    }

    public static Node assign(int line, String op, List<Node> parts) {
        return new Node(Kind.ASSIGN, line, op, parts, null, null, false, false, null);
    }

    public static Node exprStmt(int line, Node expr) {
        return new Node(Kind.EXPR_STMT, line, null, List.of(expr), null, null, false, false, null);
    }

    public static Node simpleStmt(int line, String keyword, Node expr) {
        return new Node(Kind.SIMPLE_STMT, line, keyword, expr == null ? null : List.of(expr), null, null,
                false, false, null);
    }

    public static Node comment(int line, String text) {
        return new Node(Kind.COMMENT, line, text, null, null, null, false, false, null);
    }

    public static Node blank(int line) {
        return new Node(Kind.BLANK, line, null, null, null, null, false, false, null);
    }

    public static Node sequence(List<Node> pieces, boolean spaceBefore) {
        return new Node(Kind.SEQUENCE, 0, null, pieces, null, null, spaceBefore, false, null);
    }

    public static Node sequence(Node... pieces) {
        return sequence(List.of(pieces), false);
    }

    public static Node name(String name, boolean spaceBefore) {
        return new Node(Kind.NAME, 0, name, null, null, null, spaceBefore, false, null);
    }

    public static Node literal(String text, boolean spaceBefore) {
        return new Node(Kind.LITERAL, 0, text, null, null, null, spaceBefore, false, null);
    }

    public static Node operator(String text, boolean spaceBefore) {
        return new Node(Kind.OPERATOR, 0, text, null, null, null, spaceBefore, false, null);
    }

    public static Node attribute(Node value, String attr) {
        return new Node(Kind.ATTRIBUTE, 0, attr, List.of(value), null, null, value.spaceBefore, false, null);
    }

    public static Node call(Node callee, List<Node> args, boolean trailingComma) {
        List<Node> all = new ArrayList<>(args.size() + 1);
        all.add(callee);
        all.addAll(args);
        return new Node(Kind.CALL, 0, null, all, null, null, callee.spaceBefore, trailingComma, null);
    }

    public static Node arg(String keyword, Node value) {
        return new Node(Kind.ARG, 0, keyword, List.of(value), null, null, false, false, null);
    }

    public static Node subscript(Node value, Node index) {
        return new Node(Kind.SUBSCRIPT, 0, null, List.of(value, index), null, null, value.spaceBefore, false, null);
    }

    public static Node group(String open, List<Node> elements, boolean trailingComma, boolean spaceBefore) {
        return new Node(Kind.GROUP, 0, open, elements, null, null, spaceBefore, trailingComma, null);
    }

    /* ======================= 拷贝修改 ======================= */

    public Node withChildren(List<Node> newChildren) {
        return new Node(kind, line, text, newChildren, body, decorators, spaceBefore, trailingComma, comment);
    }

    public Node withBody(List<Node> newBody) {
        return new Node(kind, line, text, children, newBody, decorators, spaceBefore, trailingComma, comment);
    }

    public Node withText(String newText) {
        return new Node(kind, line, newText, children, body, decorators, spaceBefore, trailingComma, comment);
    }

    public Node withDecorators(List<Node> newDecorators) {
        return new Node(kind, line, text, children, body, newDecorators, spaceBefore, trailingComma, comment);
    }

    public Node withSpaceBefore(boolean space) {
        if (space == spaceBefore) return this;
        return new Node(kind, line, text, children, body, decorators, space, trailingComma, comment);
    }

    public Node withComment(String newComment) {
        return new Node(kind, line, text, children, body, decorators, spaceBefore, trailingComma, newComment);
    }

    /* ======================= 访问器 ======================= */

    public Kind kind() {
        return kind;
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    public int line() {
        return line;
    }

    public String text() {
        return text;
    }

    public List<Node> children() {
        return children;
    }

    public Node child(int i) {
        return children.get(i);
    }

    public List<Node> body() {
        return body;
    }

    public List<Node> decorators() {
        return decorators;
    }

    public boolean spaceBefore() {
        return spaceBefore;
    }

    public boolean trailingComma() {
        return trailingComma;
    }

    public String comment() {
        return comment;
    }

    /** CALL only: the argument nodes, without the callee. */
    public List<Node> args() {
        return kind == Kind.CALL ? children.subList(1, children.size()) : List.of();
    }

    /** FUNCTION_DEF only: parameter ARG nodes. */
    public List<Node> params() {
        if (kind != Kind.FUNCTION_DEF) return List.of();
        List<Node> out = new ArrayList<>();
        for (Node c : children) {
            if (c.kind == Kind.ARG) out.add(c);
        }
        return out;
    }

    @Override
    public String toString() {
        return kind + (text == null ? "" : "(" + text + ")") + (line > 0 ? "@" + line : "");
    }
}
