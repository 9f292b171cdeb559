package com.initialone.jqport.fix;

import com.initialone.jqport.util.PyText;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Repairs delimiter damage outside string literals:
 * <ul>
 *   <li>{@code f(, a)} and {@code f(a,, b)}: orphaned commas</li>
 *   <li>{@code f(a, )}: trailing comma inside call parentheses (tuples keep theirs)</li>
 *   <li>a bracket left open when the next statement starts: closed at the end of the last code line</li>
 *   <li>an unmatched closing bracket at the end of a line: dropped</li>
 * </ul>
 */
public final class DelimiterRepairPass implements FixPass {

    private static final Pattern NEW_STATEMENT = Pattern.compile(
            "^(def|class|if|elif|else|for|while|try|except|finally|with|return|import|from|pass|break|continue|raise|global)\\b"
                    + "|^[A-Za-z_][\\w.]*(\\[[^\\]]*])?\\s*([-+*/%&|^]|//|\\*\\*)?=(?!=)");

    /** 调用括号与普通括号分开记，只有调用括号里的尾逗号会被删掉 */
    private static final char CALL_PAREN = 'c';

    @Override
    public String name() {
        return "delimiters";
    }

    @Override
    public String apply(String text) {
        List<String> lines = PyText.lines(text);
        List<PyText.LineInfo> info = PyText.scan(lines);
        List<String> out = new ArrayList<>(lines.size());
        Deque<Character> stack = new ArrayDeque<>();
        int openerIndent = 0;
        int lastCode = -1;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (info.get(i).inString || line.contains("'''") || line.contains("\"\"\"")
                    || PyText.isBlank(line) || PyText.isComment(line)) {
                out.add(line);
                continue;
            }
            if (!stack.isEmpty() && PyText.indentWidth(line) <= openerIndent
                    && NEW_STATEMENT.matcher(line.strip()).find()) {
                out.set(lastCode, appendClosers(out.get(lastCode), stack));
                stack.clear();
            }
            if (stack.isEmpty()) openerIndent = PyText.indentWidth(line);
            out.add(repair(line, stack));
            lastCode = out.size() - 1;
        }
        if (!stack.isEmpty() && lastCode >= 0) {
            out.set(lastCode, appendClosers(out.get(lastCode), stack));
        }
        return PyText.join(out);
    }

    static String repair(String line, Deque<Character> stack) {
        String masked = PyText.mask(line);
        int codeEnd = masked.length();
        StringBuilder sb = new StringBuilder(line.length());
        boolean skipSpaces = false;
        for (int k = 0; k < codeEnd; k++) {
            char m = masked.charAt(k);
            char c = line.charAt(k);
            if (skipSpaces && c == ' ') continue;
            skipSpaces = false;
            switch (m) {
                case '(':
                    stack.push(isCallParen(sb) ? CALL_PAREN : '(');
                    sb.append(c);
                    break;
                case '[':
                case '{':
                    stack.push(m);
                    sb.append(c);
                    break;
                case ')':
                case ']':
                case '}':
                    if (stack.isEmpty()) {
                        if (onlyClosersAfter(masked, k + 1)) continue;
                    } else {
                        stack.pop();
                    }
                    sb.append(c);
                    break;
                case ',': {
                    char prev = lastNonSpace(sb);
                    char next = nextNonSpace(masked, k + 1);
                    boolean orphan = prev == '(' || prev == ',';
                    boolean trailing = next == ')' && !stack.isEmpty() && stack.peek() == CALL_PAREN;
                    if (orphan || trailing) {
                        while (sb.length() > 0 && sb.charAt(sb.length() - 1) == ' ') sb.setLength(sb.length() - 1);
                        char before = lastNonSpace(sb);
                        skipSpaces = before == '(' || trailing;
                        continue;
                    }
                    sb.append(c);
                    break;
                }
                default:
                    sb.append(c);
            }
        }
        sb.append(line.substring(codeEnd));
        return sb.toString();
    }

    private static String appendClosers(String line, Deque<Character> stack) {
        String masked = PyText.mask(line);
        String code = line.substring(0, masked.length());
        String comment = line.substring(masked.length());
        String trimmed = code.stripTrailing();
        StringBuilder sb = new StringBuilder(trimmed);
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == ',' && stack.peek() == CALL_PAREN) {
            sb.setLength(sb.length() - 1);
        }
        for (Iterator<Character> it = stack.iterator(); it.hasNext(); ) {
            char open = it.next();
            sb.append(open == '[' ? ']' : open == '{' ? '}' : ')');
        }
        if (!comment.isEmpty()) sb.append(code.substring(trimmed.length())).append(comment);
        return sb.toString();
    }

    private static boolean isCallParen(StringBuilder sb) {
        int i = sb.length() - 1;
        if (i < 0) return false;
        char p = sb.charAt(i);
        if (!(Character.isLetterOrDigit(p) || p == '_' || p == ')' || p == ']')) return false;
        // "if (" / "and (" 之类是普通括号
        int s = i;
        while (s >= 0 && (Character.isLetterOrDigit(sb.charAt(s)) || sb.charAt(s) == '_')) s--;
        String word = sb.substring(s + 1, i + 1);
        switch (word) {
            case "if":
            case "elif":
            case "while":
            case "for":
            case "in":
            case "is":
            case "and":
            case "or":
            case "not":
            case "else":
            case "return":
            case "yield":
            case "lambda":
            case "assert":
                return false;
            default:
                return true;
        }
    }

    private static boolean onlyClosersAfter(String masked, int from) {
        for (int i = from; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c != ' ' && c != ')' && c != ']' && c != '}' && c != '\t') return false;
        }
        return true;
    }

    private static char lastNonSpace(StringBuilder sb) {
        for (int i = sb.length() - 1; i >= 0; i--) {
            if (sb.charAt(i) != ' ' && sb.charAt(i) != '\t') return sb.charAt(i);
        }
        return 0;
    }

    private static char nextNonSpace(String s, int from) {
        for (int i = from; i < s.length(); i++) {
            if (s.charAt(i) != ' ' && s.charAt(i) != '\t') return s.charAt(i);
        }
        return 0;
    }
}
