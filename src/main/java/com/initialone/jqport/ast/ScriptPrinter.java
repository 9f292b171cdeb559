package com.initialone.jqport.ast;

import java.util.List;

/**
 * Turns a tree back into script text. Four-space indentation, one blank line around top-level
 * definitions, runs of blank lines collapsed. Spacing inside expressions follows the source tokens.
 */
public final class ScriptPrinter {

    private static final String INDENT = "    ";
    public static final String REVIEW_MARK = "# [REVIEW]";

    private ScriptPrinter() {
    }

    public static String print(SyntaxTree tree) {
        return print(tree.root());
    }

    public static String print(Node module) {
        StringBuilder sb = new StringBuilder();
        List<Node> body = module.body();
        Node prev = null;
        for (Node s : body) {
            boolean isDef = s.is(Node.Kind.FUNCTION_DEF) || s.is(Node.Kind.CLASS_DEF);
            boolean prevDef = prev != null && (prev.is(Node.Kind.FUNCTION_DEF) || prev.is(Node.Kind.CLASS_DEF));
            if (s.is(Node.Kind.BLANK)) {
                if (prev != null && !prev.is(Node.Kind.BLANK)) sb.append('\n');
                prev = s;
                continue;
            }
            if (prev != null && !prev.is(Node.Kind.BLANK) && !prev.is(Node.Kind.COMMENT) && (isDef || prevDef)) {
                sb.append('\n');
            }
            statement(s, 0, sb);
            prev = s;
        }
        String out = sb.toString();
        while (out.endsWith("\n\n")) out = out.substring(0, out.length() - 1);
        return out;
    }

    /** Prints one statement (and its block) at the given indentation depth. */
    public static String statement(Node s, int depth) {
        StringBuilder sb = new StringBuilder();
        statement(s, depth, sb);
        return sb.toString();
    }

    private static void statement(Node s, int depth, StringBuilder sb) {
        String pad = INDENT.repeat(depth);
        switch (s.kind()) {
            case MODULE:
                sb.append(print(s));
                return;
            case FUNCTION_DEF: {
                for (Node d : s.decorators()) {
                    sb.append(pad).append('@').append(expression(d)).append('\n');
                }
                StringBuilder head = new StringBuilder("def ").append(s.text()).append('(');
                head.append(joinArgs(s.params(), false)).append(')');
                Node annotation = s.children().isEmpty() ? null : s.children().get(s.children().size() - 1);
                if (annotation != null && annotation.is(Node.Kind.SEQUENCE)) {
                    head.append(" -> ").append(expression(annotation));
                }
                head.append(':');
                line(sb, pad, head.toString(), s);
                block(s.body(), depth + 1, sb);
                return;
            }
            case CLASS_DEF: {
                for (Node d : s.decorators()) {
                    sb.append(pad).append('@').append(expression(d)).append('\n');
                }
                String head = "class " + s.text()
                        + (s.children().isEmpty() ? "" : "(" + joinArgs(s.children(), false) + ")") + ":";
                line(sb, pad, head, s);
                block(s.body(), depth + 1, sb);
                return;
            }
            case COMPOUND: {
                String head = s.text() + (s.children().isEmpty() ? "" : " " + expression(s.child(0))) + ":";
                line(sb, pad, head, s);
                block(s.body(), depth + 1, sb);
                return;
            }
            case ASSIGN: {
                StringBuilder text = new StringBuilder();
                List<Node> parts = s.children();
                for (int i = 0; i < parts.size(); i++) {
                    if (i > 0) text.append(' ').append(s.text()).append(' ');
                    text.append(expression(parts.get(i)));
                }
                line(sb, pad, text.toString(), s);
                return;
            }
            case EXPR_STMT:
                line(sb, pad, expression(s.child(0)), s);
                return;
            case SIMPLE_STMT:
                line(sb, pad, s.children().isEmpty() ? s.text() : s.text() + " " + expression(s.child(0)), s);
                return;
            case COMMENT:
                line(sb, pad, s.text(), s);
                return;
            case BLANK:
                sb.append('\n');
                return;
            default:
                throw new IllegalArgumentException("not a statement: " + s);
        }
    }

    private static void block(List<Node> body, int depth, StringBuilder sb) {
        int start = 0;
        int end = body.size();
        while (start < end && body.get(start).is(Node.Kind.BLANK)) start++;
        while (end > start && body.get(end - 1).is(Node.Kind.BLANK)) end--;
        boolean hasCode = false;
        for (int i = start; i < end; i++) {
            Node.Kind k = body.get(i).kind();
            if (k != Node.Kind.BLANK && k != Node.Kind.COMMENT) hasCode = true;
        }
        boolean prevBlank = false;
        for (int i = start; i < end; i++) {
            Node s = body.get(i);
            if (s.is(Node.Kind.BLANK)) {
                if (!prevBlank) sb.append('\n');
                prevBlank = true;
                continue;
            }
            prevBlank = false;
            statement(s, depth, sb);
        }
        if (!hasCode) {
            sb.append(INDENT.repeat(depth)).append("pass\n");
        }
    }

    private static void line(StringBuilder sb, String pad, String text, Node s) {
        sb.append(pad).append(text);
        if (s.comment() != null) sb.append("  ").append(s.comment());
        sb.append('\n');
    }

    /* ======================= 表达式 ======================= */

    public static String expression(Node n) {
        StringBuilder sb = new StringBuilder();
        expression(n, sb);
        return sb.toString();
    }

    private static void expression(Node n, StringBuilder sb) {
        switch (n.kind()) {
            case SEQUENCE: {
                Node prev = null;
                for (Node piece : n.children()) {
                    if (prev != null && needsSpace(prev, piece)) sb.append(' ');
                    expression(piece, sb);
                    prev = piece;
                }
                return;
            }
            case NAME:
            case LITERAL:
            case OPERATOR:
                sb.append(n.text());
                return;
            case ATTRIBUTE:
                expression(n.child(0), sb);
                sb.append('.').append(n.text());
                return;
            case CALL:
                expression(n.child(0), sb);
                sb.append('(').append(joinArgs(n.args(), n.trailingComma())).append(')');
                return;
            case ARG:
                if (n.text() != null) sb.append(n.text()).append('=');
                expression(n.child(0), sb);
                return;
            case SUBSCRIPT:
                expression(n.child(0), sb);
                expression(n.child(1), sb);
                return;
            case GROUP: {
                String open = n.text();
                String close = open.equals("(") ? ")" : open.equals("[") ? "]" : "}";
                sb.append(open);
                List<Node> elements = n.children();
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) sb.append(", ");
                    expression(elements.get(i), sb);
                }
                if (n.trailingComma()) sb.append(',');
                sb.append(close);
                return;
            }
            default:
                throw new IllegalArgumentException("not an expression: " + n);
        }
    }

    private static String joinArgs(List<Node> args, boolean trailingComma) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            expression(args.get(i), sb);
        }
        if (trailingComma && !args.isEmpty()) sb.append(',');
        return sb.toString();
    }

    private static boolean needsSpace(Node prev, Node piece) {
        if (piece.spaceBefore()) return true;
        if (isWordOperator(piece)) return true;
        if (isWordOperator(prev)) return !piece.is(Node.Kind.OPERATOR) || isWordOperator(piece);
        return endsWord(prev) && startsWord(piece);
    }

    private static boolean isWordOperator(Node n) {
        return n.is(Node.Kind.OPERATOR) && !n.text().isEmpty() && Character.isLetter(n.text().charAt(0));
    }

    private static boolean endsWord(Node n) {
        switch (n.kind()) {
            case NAME:
            case LITERAL:
            case ATTRIBUTE:
            case CALL:
            case SUBSCRIPT:
                return true;
            default:
                return false;
        }
    }

    private static boolean startsWord(Node n) {
        switch (n.kind()) {
            case NAME:
            case LITERAL:
                return true;
            case ATTRIBUTE:
            case CALL:
            case SUBSCRIPT:
                return startsWord(n.child(0));
            default:
                return false;
        }
    }
}
