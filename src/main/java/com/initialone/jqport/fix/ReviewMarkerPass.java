package com.initialone.jqport.fix;

import com.initialone.jqport.util.PyText;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Disables every remaining live call to a removed API. The statement is turned into a
 * {@code # [REVIEW]} comment (a {@code pass} is left behind when the block would become empty);
 * a block header that contains such a call only gets the marker appended.
 */
public final class ReviewMarkerPass implements FixPass {

    static final String MARK = "# [REVIEW]";

    private final Pattern removedCall;

    public ReviewMarkerPass(Set<String> removedCalls) {
        if (removedCalls.isEmpty()) {
            removedCall = null;
        } else {
            List<String> alternatives = new ArrayList<>();
            for (String name : removedCalls) alternatives.add(Pattern.quote(name));
            removedCall = Pattern.compile("(?<![\\w.])(" + String.join("|", alternatives) + ")\\s*\\(");
        }
    }

    @Override
    public String name() {
        return "review-markers";
    }

    @Override
    public String apply(String text) {
        if (removedCall == null) return text;
        List<String> lines = PyText.lines(text);
        List<PyText.LineInfo> info = PyText.scan(lines);
        List<String> out = new ArrayList<>(lines.size());
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            PyText.LineInfo li = info.get(i);
            int end = i;
            while (end + 1 < lines.size() && info.get(end + 1).continuation) end++;
            if (!li.isLogicalStart() || PyText.isBlank(line) || PyText.isComment(line)) {
                out.add(line);
                i++;
                continue;
            }
            String hit = null;
            for (int k = i; k <= end && hit == null; k++) {
                Matcher m = removedCall.matcher(PyText.mask(lines.get(k)));
                if (m.find()) hit = m.group(1);
            }
            if (hit == null) {
                for (int k = i; k <= end; k++) out.add(lines.get(k));
                i = end + 1;
                continue;
            }
            String last = lines.get(end);
            if (PyText.stripComment(last).endsWith(":") && info.get(end).depthAtEnd == 0) {
                for (int k = i; k < end; k++) out.add(lines.get(k));
                out.add(last.contains(MARK) ? last : last + "  " + MARK + " uses removed call " + hit);
                i = end + 1;
                continue;
            }
            String indent = line.substring(0, line.length() - line.stripLeading().length());
            for (int k = i; k <= end; k++) {
                out.add(indent + MARK + " removed call " + hit + ": " + lines.get(k).strip());
            }
            i = end + 1;
        }
        return PyText.join(fillEmptyBlocks(out));
    }

    /** Puts a {@code pass} under every block header whose body is now comments only. */
    static List<String> fillEmptyBlocks(List<String> lines) {
        List<PyText.LineInfo> info = PyText.scan(lines);
        List<String> out = new ArrayList<>(lines.size() + 4);
        // 行号 -> 紧跟其后补上的 pass
        Map<Integer, String> passAfter = new HashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            out.add(line);
            String pending = passAfter.remove(i);
            if (pending != null) out.add(pending);
            PyText.LineInfo li = info.get(i);
            if (li.inString || PyText.isBlank(line) || PyText.isComment(line)) continue;
            boolean logicalEnd = i + 1 >= lines.size() || !info.get(i + 1).continuation;
            if (!logicalEnd || li.depthAtEnd != 0 || !PyText.stripComment(line).endsWith(":")) continue;
            int headerStart = i;
            while (headerStart > 0 && info.get(headerStart).continuation) headerStart--;
            int headerIndent = PyText.indentWidth(lines.get(headerStart));
            int next = i + 1;
            int lastInnerComment = -1;
            while (next < lines.size() && (PyText.isBlank(lines.get(next)) || PyText.isComment(lines.get(next)))) {
                if (PyText.isComment(lines.get(next)) && PyText.indentWidth(lines.get(next)) > headerIndent) {
                    lastInnerComment = next;
                }
                next++;
            }
            if (next < lines.size() && PyText.indentWidth(lines.get(next)) > headerIndent) continue;
            String stub = " ".repeat(headerIndent + 4) + "pass";
            if (lastInnerComment < 0) {
                out.add(stub);
            } else {
                passAfter.put(lastInnerComment, stub);
            }
        }
        return out;
    }
}
