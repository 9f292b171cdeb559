package com.initialone.jqport.ast;

import com.initialone.jqport.model.ScriptParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 行缩进敏感的分词器。
 * - 括号内换行不产生 NEWLINE
 * - 独占一行的注释 / 空行先暂存，等下一行代码的缩进确定后再决定落在哪个代码块里
 */
final class ScriptLexer {

    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", "==", "!=", "<=", ">=", "<<", ">>",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "@", "="
    };

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String src;
    private int pos;
    private int line = 1;
    private int lineStart;

    private final List<Token> out = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Token> brackets = new ArrayDeque<>();
    private final List<Token> pending = new ArrayList<>();

    ScriptLexer(String src) {
        this.src = src;
        indents.push(0);
    }

    List<Token> tokenize() throws ScriptParseException {
        boolean atLineStart = true;
        boolean space = false;
        int len = src.length();

        while (pos < len) {
            if (atLineStart && brackets.isEmpty()) {
                int width = 0;
                int p = pos;
                while (p < len && (src.charAt(p) == ' ' || src.charAt(p) == '\t' || src.charAt(p) == '\f')) {
                    width = src.charAt(p) == '\t' ? (width / 8 + 1) * 8 : width + 1;
                    p++;
                }
                if (p >= len) {
                    pos = p;
                    break;
                }
                char c = src.charAt(p);
                if (c == '\n' || c == '\r') {
                    pending.add(new Token(Token.Type.BLANK_LINE, "", line, 1, false));
                    pos = p;
                    consumeNewline();
                    continue;
                }
                if (c == '#') {
                    pos = p;
                    String text = readComment();
                    pending.add(new Token(Token.Type.COMMENT_LINE, text, line, width + 1, false));
                    if (pos < len) consumeNewline();
                    continue;
                }
                pos = p;
                indent(width);
                atLineStart = false;
                space = false;
                continue;
            }

            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
                space = true;
                continue;
            }
            if (c == '\\' && pos + 1 < len && (src.charAt(pos + 1) == '\n' || src.charAt(pos + 1) == '\r')) {
                pos++;
                consumeNewline();
                space = true;
                continue;
            }
            if (c == '\n' || c == '\r') {
                consumeNewline();
                if (!brackets.isEmpty()) {
                    space = true;
                    continue;
                }
                emit(Token.Type.NEWLINE, "", line - 1, 0, false);
                atLineStart = true;
                continue;
            }

            int col = pos - lineStart + 1;
            int startLine = line;
            if (c == '#') {
                String text = readComment();
                out.add(new Token(Token.Type.COMMENT, text, startLine, col, true));
                continue;
            }
            if (isIdentStart(c)) {
                int s = pos;
                while (pos < len && isIdentPart(src.charAt(pos))) pos++;
                String word = src.substring(s, pos);
                if (pos < len && (src.charAt(pos) == '\'' || src.charAt(pos) == '"')
                        && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
                    readString(s, startLine, col, space);
                } else {
                    emit(Token.Type.NAME, word, startLine, col, space);
                }
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < len && Character.isDigit(src.charAt(pos + 1)))) {
                readNumber(startLine, col, space);
            } else if (c == '\'' || c == '"') {
                readString(pos, startLine, col, space);
            } else {
                String op = matchOperator();
                if (op == null) {
                    throw new ScriptParseException("unexpected character '" + c + "'", startLine, col);
                }
                pos += op.length();
                Token t = new Token(Token.Type.OP, op, startLine, col, space);
                trackBracket(t);
                out.add(t);
            }
            space = false;
        }

        if (!brackets.isEmpty()) {
            Token open = brackets.peek();
            throw new ScriptParseException("'" + open.text + "' was never closed", open.line, open.column);
        }
        if (!out.isEmpty() && last().type != Token.Type.NEWLINE
                && last().type != Token.Type.DEDENT && last().type != Token.Type.INDENT) {
            emit(Token.Type.NEWLINE, "", line, 0, false);
        }
        indent(0);
        out.addAll(pending);
        pending.clear();
        out.add(new Token(Token.Type.EOF, "", line, 1, false));
        return out;
    }

    /* ======================= 缩进 ======================= */

    private void indent(int width) throws ScriptParseException {
        int cur = indents.peek();
        if (width > cur) {
            indents.push(width);
            out.add(new Token(Token.Type.INDENT, "", line, 1, false));
            flushPending(pending.size());
            return;
        }
        if (width == cur) {
            flushPending(pending.size());
            return;
        }
        // 比新缩进更深的注释仍属于即将结束的代码块
        int split = 0;
        for (int i = 0; i < pending.size(); i++) {
            Token t = pending.get(i);
            if (t.type == Token.Type.COMMENT_LINE && t.column - 1 > width) split = i + 1;
        }
        flushPending(split);
        while (indents.peek() > width) {
            indents.pop();
            out.add(new Token(Token.Type.DEDENT, "", line, 1, false));
        }
        if (indents.peek() != width) {
            throw new ScriptParseException("unindent does not match any outer indentation level", line, width + 1);
        }
        flushPending(pending.size());
    }

    private void flushPending(int n) {
        for (int i = 0; i < n; i++) out.add(pending.get(i));
        pending.subList(0, n).clear();
    }

    /* ======================= 各类 token ======================= */

    private String readComment() {
        int s = pos;
        while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') pos++;
        return src.substring(s, pos).stripTrailing();
    }

    private void readNumber(int startLine, int col, boolean space) {
        int s = pos;
        int len = src.length();
        if (src.startsWith("0x", pos) || src.startsWith("0X", pos)
                || src.startsWith("0b", pos) || src.startsWith("0B", pos)
                || src.startsWith("0o", pos) || src.startsWith("0O", pos)) {
            pos += 2;
            while (pos < len && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        } else {
            while (pos < len) {
                char c = src.charAt(pos);
                if (Character.isDigit(c) || c == '_' || c == '.') {
                    pos++;
                } else if ((c == 'e' || c == 'E') && pos + 1 < len) {
                    pos++;
                    if (src.charAt(pos) == '+' || src.charAt(pos) == '-') pos++;
                } else {
                    break;
                }
            }
            if (pos < len && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) pos++;
        }
        emit(Token.Type.NUMBER, src.substring(s, pos), startLine, col, space);
    }

    private void readString(int start, int startLine, int col, boolean space) throws ScriptParseException {
        char q = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(q).repeat(3), pos);
        pos += triple ? 3 : 1;
        int len = src.length();
        while (true) {
            if (pos >= len) {
                throw new ScriptParseException("unterminated string literal", startLine, col);
            }
            char c = src.charAt(pos);
            if (c == '\\' && pos + 1 < len) {
                if (src.charAt(pos + 1) == '\n' || src.charAt(pos + 1) == '\r') {
                    pos++;
                    consumeNewline();
                } else {
                    pos += 2;
                }
                continue;
            }
            if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new ScriptParseException("unterminated string literal", startLine, col);
                }
                consumeNewline();
                continue;
            }
            if (c == q) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (src.startsWith(String.valueOf(q).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
            }
            pos++;
        }
        emit(Token.Type.STRING, src.substring(start, pos), startLine, col, space);
    }

    private String matchOperator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) return op;
        }
        return null;
    }

    private void trackBracket(Token t) throws ScriptParseException {
        switch (t.text) {
            case "(", "[", "{" -> brackets.push(t);
            case ")", "]", "}" -> {
                if (brackets.isEmpty()) {
                    throw new ScriptParseException("unmatched '" + t.text + "'", t.line, t.column);
                }
                Token open = brackets.pop();
                if (!closes(open.text, t.text)) {
                    throw new ScriptParseException("closing '" + t.text + "' does not match '" + open.text
                            + "' opened at line " + open.line, t.line, t.column);
                }
            }
            default -> {
            }
        }
    }

    private static boolean closes(String open, String close) {
        return (open.equals("(") && close.equals(")"))
                || (open.equals("[") && close.equals("]"))
                || (open.equals("{") && close.equals("}"));
    }

    /* ======================= 工具 ======================= */

    private void consumeNewline() {
        if (src.charAt(pos) == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') pos++;
        pos++;
        line++;
        lineStart = pos;
    }

    private void emit(Token.Type type, String text, int l, int col, boolean space) {
        out.add(new Token(type, text, l, col, space));
    }

    private Token last() {
        for (int i = out.size() - 1; i >= 0; i--) {
            Token t = out.get(i);
            if (t.type != Token.Type.COMMENT) return t;
        }
        return out.get(out.size() - 1);
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
