package com.initialone.jqport.fix;

import com.initialone.jqport.util.PyText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Makes sure every mandatory lifecycle function is defined exactly once at top level: a missing one
 * gets an empty stub, a repeated one is renamed and marked for review.
 */
public final class LifecycleCheckPass implements FixPass {

    private static final Pattern TOP_LEVEL_DEF = Pattern.compile("^def\\s+([A-Za-z_]\\w*)\\s*\\(");

    /** 生命周期函数名 -> 参数列表，例如 handle_data -> "context, data" */
    private final Map<String, String> lifecycle;

    public LifecycleCheckPass(Map<String, String> lifecycle) {
        this.lifecycle = new LinkedHashMap<>(lifecycle);
    }

    @Override
    public String name() {
        return "lifecycle";
    }

    @Override
    public String apply(String text) {
        List<String> lines = new ArrayList<>(PyText.lines(text));
        List<PyText.LineInfo> info = PyText.scan(lines);
        Map<String, Integer> seen = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            if (!info.get(i).isLogicalStart()) continue;
            Matcher m = TOP_LEVEL_DEF.matcher(lines.get(i));
            if (!m.find() || !lifecycle.containsKey(m.group(1))) continue;
            String name = m.group(1);
            int count = seen.merge(name, 1, Integer::sum);
            if (count > 1) {
                String renamed = name + "_duplicate_" + count;
                String line = lines.get(i);
                lines.set(i, line.substring(0, m.start(1)) + renamed + line.substring(m.end(1))
                        + "  # [REVIEW] duplicate " + name + " renamed, merge it by hand");
            }
        }
        for (Map.Entry<String, String> e : lifecycle.entrySet()) {
            if (seen.containsKey(e.getKey())) continue;
            while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) lines.remove(lines.size() - 1);
            if (!lines.isEmpty()) {
                lines.add("");
                lines.add("");
            }
            lines.add("def " + e.getKey() + "(" + e.getValue() + "):");
            lines.add("    pass");
        }
        String out = PyText.join(lines);
        verify(out);
        return out;
    }

    private void verify(String text) {
        List<String> lines = PyText.lines(text);
        List<PyText.LineInfo> info = PyText.scan(lines);
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            if (!info.get(i).isLogicalStart()) continue;
            Matcher m = TOP_LEVEL_DEF.matcher(lines.get(i));
            if (m.find()) counts.merge(m.group(1), 1, Integer::sum);
        }
        for (String name : lifecycle.keySet()) {
            if (counts.getOrDefault(name, 0) != 1) {
                throw new IllegalStateException("lifecycle function " + name + " defined "
                        + counts.getOrDefault(name, 0) + " times after repair");
            }
        }
    }
}
