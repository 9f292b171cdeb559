package com.initialone.jqport.fix;

import com.initialone.jqport.util.PyText;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes repeated registration / configuration calls and repeated imports within one block.
 * A repeat only counts when it sits at the same indentation with no dedent in between, so identical
 * lines in sibling branches ({@code if} / {@code else}) are left alone.
 */
public final class DuplicateStatementPass implements FixPass {

    private final Set<String> registrationCalls;

    public DuplicateStatementPass(Set<String> registrationCalls) {
        this.registrationCalls = Set.copyOf(registrationCalls);
    }

    @Override
    public String name() {
        return "dedupe";
    }

    @Override
    public String apply(String text) {
        List<String> lines = PyText.lines(text);
        List<PyText.LineInfo> info = PyText.scan(lines);
        List<String> out = new ArrayList<>(lines.size());
        // 缩进宽度 -> 该层已出现过的语句
        Map<Integer, List<String>> seen = new HashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            PyText.LineInfo li = info.get(i);
            if (!li.isLogicalStart() || PyText.isBlank(line) || PyText.isComment(line)) {
                out.add(line);
                continue;
            }
            int indent = PyText.indentWidth(line);
            seen.keySet().removeIf(w -> w > indent);
            String code = PyText.stripComment(line).strip();
            boolean singleLine = li.depthAtEnd == 0 && !code.endsWith("\\");
            if (singleLine && isCandidate(code)) {
                List<String> level = seen.computeIfAbsent(indent, k -> new ArrayList<>());
                if (level.contains(code)) continue;
                level.add(code);
            }
            out.add(line);
        }
        return PyText.join(out);
    }

    private boolean isCandidate(String code) {
        if (code.startsWith("import ") || (code.startsWith("from ") && code.contains(" import "))) return true;
        int paren = code.indexOf('(');
        if (paren <= 0) return false;
        return registrationCalls.contains(code.substring(0, paren).strip()) && code.endsWith(")");
    }
}
