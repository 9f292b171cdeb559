package com.initialone.jqport.fix;

import com.initialone.jqport.util.PyText;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-indents every logical line to a multiple of four spaces. Source widths are mapped onto block
 * levels with an indent stack, so nesting is kept; a width between two known levels snaps to the
 * nearest one. Continuation lines move with their statement, lines inside triple-quoted strings
 * are left as they are.
 */
public final class IndentationPass implements FixPass {

    private static final int UNIT = 4;

    @Override
    public String name() {
        return "indentation";
    }

    @Override
    public String apply(String text) {
        List<String> lines = PyText.lines(text);
        List<PyText.LineInfo> info = PyText.scan(lines);
        List<String> out = new ArrayList<>(lines.size());

        // widths[i] 是第 i 层代码块在源文本里的缩进宽度
        List<Integer> widths = new ArrayList<>();
        widths.add(0);
        boolean opener = false;
        int delta = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            PyText.LineInfo li = info.get(i);
            if (li.inString) {
                out.add(line);
                continue;
            }
            if (PyText.isBlank(line)) {
                out.add("");
                continue;
            }
            int width = PyText.indentWidth(line);
            String content = line.substring(leadingLength(line));
            if (li.continuation) {
                out.add(" ".repeat(Math.max(0, width + delta)) + content);
                continue;
            }
            if (PyText.isComment(line)) {
                boolean inNewBlock = opener && width > widths.get(widths.size() - 1);
                int level = inNewBlock ? widths.size() : nearestLevel(widths, width);
                out.add(" ".repeat(level * UNIT) + content);
                continue;
            }

            int level;
            int top = widths.get(widths.size() - 1);
            if (opener) {
                // 块头之后必须更深一层；源文本没缩进时也强制进一层
                widths.add(Math.max(width, top + 1));
                level = widths.size() - 1;
            } else if (width >= top) {
                level = widths.size() - 1;
            } else {
                while (widths.size() > 1 && widths.get(widths.size() - 1) > width) {
                    widths.remove(widths.size() - 1);
                }
                int outer = widths.get(widths.size() - 1);
                if (outer != width && width - outer > UNIT / 2) {
                    // 落在两层之间且更靠近内层：视为内层
                    widths.add(width);
                }
                level = widths.size() - 1;
            }
            String indented = " ".repeat(level * UNIT) + content;
            delta = level * UNIT - width;
            out.add(indented);

            int end = i;
            while (end + 1 < lines.size() && info.get(end + 1).continuation) end++;
            String last = end == i ? line : lines.get(end);
            opener = info.get(end).depthAtEnd == 0 && PyText.stripComment(last).endsWith(":")
                    && !info.get(end).inString;
        }
        return PyText.join(out);
    }

    private static int nearestLevel(List<Integer> widths, int width) {
        int best = 0;
        int bestDistance = Integer.MAX_VALUE;
        for (int i = 0; i < widths.size(); i++) {
            int d = Math.abs(widths.get(i) - width);
            if (d < bestDistance) {
                best = i;
                bestDistance = d;
            }
        }
        return best;
    }

    private static int leadingLength(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t' || line.charAt(i) == '\f')) i++;
        return i;
    }
}
