package com.initialone.jqport.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical helpers for line-based passes over script text: string / comment aware scanning without
 * building a tree.
 */
public final class PyText {

    private PyText() {
    }

    /** Per-line facts gathered by {@link #scan(List)}. */
    public static final class LineInfo {
        /** 行首处于三引号字符串内部 */
        public final boolean inString;
        /** 行首处于未闭合括号内，或上一行以反斜杠续行 */
        public final boolean continuation;
        /** 行尾时未闭合的括号层数 */
        public final int depthAtEnd;

        LineInfo(boolean inString, boolean continuation, int depthAtEnd) {
            this.inString = inString;
            this.continuation = continuation;
            this.depthAtEnd = depthAtEnd;
        }

        /** Starts a logical line: not inside a string, bracket or backslash continuation. */
        public boolean isLogicalStart() {
            return !inString && !continuation;
        }
    }

    public static List<String> lines(String text) {
        List<String> out = new ArrayList<>(List.of(text.split("\r\n|\r|\n", -1)));
        if (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) out.remove(out.size() - 1);
        return out;
    }

    public static String join(List<String> lines) {
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }

    public static List<LineInfo> scan(List<String> lines) {
        List<LineInfo> out = new ArrayList<>(lines.size());
        String triple = null;
        int depth = 0;
        boolean backslash = false;
        for (String line : lines) {
            boolean startsInString = triple != null;
            boolean continuation = !startsInString && (depth > 0 || backslash);
            backslash = false;
            int i = 0;
            int n = line.length();
            while (i < n) {
                char c = line.charAt(i);
                if (triple != null) {
                    if (c == '\\') {
                        i += 2;
                        continue;
                    }
                    if (line.startsWith(triple, i)) {
                        i += 3;
                        triple = null;
                        continue;
                    }
                    i++;
                    continue;
                }
                if (c == '#') break;
                if (c == '\'' || c == '"') {
                    String q3 = String.valueOf(c).repeat(3);
                    if (line.startsWith(q3, i)) {
                        triple = q3;
                        i += 3;
                        continue;
                    }
                    i = skipString(line, i);
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') depth++;
                if ((c == ')' || c == ']' || c == '}') && depth > 0) depth--;
                if (c == '\\' && i == n - 1) backslash = true;
                i++;
            }
            out.add(new LineInfo(startsInString, continuation, depth));
        }
        return out;
    }

    /** Index just past the single-line string literal starting at {@code start} (the quote). */
    public static int skipString(String line, int start) {
        char q = line.charAt(start);
        int i = start + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == q) return i + 1;
            i++;
        }
        return line.length();
    }

    /** Index of the '#' starting a comment outside string literals, or -1. */
    public static int commentStart(String line) {
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '#') return i;
            if (c == '\'' || c == '"') {
                i = skipString(line, i);
                continue;
            }
            i++;
        }
        return -1;
    }

    /** The code part of a line: comment removed, string contents replaced by {@code _}. */
    public static String mask(String line) {
        StringBuilder sb = new StringBuilder(line.length());
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '#') break;
            if (c == '\'' || c == '"') {
                int end = skipString(line, i);
                sb.append(c);
                for (int k = i + 1; k < end - 1; k++) sb.append('_');
                if (end - 1 > i) sb.append(line.charAt(end - 1));
                i = end;
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    public static String stripComment(String line) {
        int c = commentStart(line);
        return (c < 0 ? line : line.substring(0, c)).stripTrailing();
    }

    /** Leading whitespace width, tabs advancing to the next multiple of 8. */
    public static int indentWidth(String line) {
        int w = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') w++;
            else if (c == '\t') w = (w / 8 + 1) * 8;
            else break;
        }
        return w;
    }

    public static boolean isBlank(String line) {
        return line.isBlank();
    }

    public static boolean isComment(String line) {
        return line.stripLeading().startsWith("#");
    }

    /**
     * Content of a simple string literal such as {@code 'open'} or {@code "9:30"}; null for
     * anything else (numbers, names, triple-quoted or f-strings).
     */
    public static String stringContent(String literal) {
        if (literal == null || literal.length() < 2) return null;
        char q = literal.charAt(0);
        if (q != '\'' && q != '"') return null;
        if (literal.charAt(literal.length() - 1) != q) return null;
        if (literal.startsWith(String.valueOf(q).repeat(3))) return null;
        String body = literal.substring(1, literal.length() - 1);
        return body.indexOf('\\') >= 0 ? null : body;
    }
}
