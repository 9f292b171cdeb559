package com.initialone.jqport.merge;

import com.initialone.jqport.ast.Node;
import com.initialone.jqport.ast.ScriptParser;
import com.initialone.jqport.ast.ScriptPrinter;
import com.initialone.jqport.model.Diagnostics;
import com.initialone.jqport.model.ScriptParseException;
import com.initialone.jqport.util.PyText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds module aliases (pd, np, datetime) used by the merged script without a matching import.
 * Placeholders such as {@code pd.DataFrame()} introduce these uses even when the source never
 * imported the module.
 */
final class MissingImports {

    private static final Map<String, String> KNOWN = new LinkedHashMap<>();

    static {
        KNOWN.put("pd", "import pandas as pd");
        KNOWN.put("np", "import numpy as np");
        KNOWN.put("datetime", "import datetime");
    }

    private static final Pattern USE = Pattern.compile("(?<![\\w.])(pd|np|datetime)\\s*\\.");

    private MissingImports() {
    }

    /**
     * Returns the import statements to add, in a fixed order. {@code sourceOwned} are the merged
     * statements that came from the script; the first of them using an alias gives the diagnostic
     * its line.
     */
    static List<Node> find(List<Node> merged, List<Node> sourceOwned, Diagnostics diagnostics) {
        Set<String> bound = new TreeSet<>();
        for (Node s : merged) collectBound(s, bound);

        Map<String, Integer> firstUse = new LinkedHashMap<>();
        for (Node s : sourceOwned) collectUses(s, firstUse);

        List<Node> out = new ArrayList<>();
        for (Map.Entry<String, String> e : KNOWN.entrySet()) {
            Integer line = firstUse.get(e.getKey());
            if (line == null || bound.contains(e.getKey())) continue;
            out.add(parse(e.getValue()));
            diagnostics.info(line, "added missing import: " + e.getValue());
        }
        return out;
    }

    /** Names bound by import statements at any depth. */
    private static void collectBound(Node s, Set<String> bound) {
        if (s.is(Node.Kind.SIMPLE_STMT) && ("import".equals(s.text()) || "from".equals(s.text()))) {
            bound.addAll(boundNames(PyText.stripComment(ScriptPrinter.statement(s, 0)).strip()));
            return;
        }
        for (Node b : s.body()) collectBound(b, bound);
    }

    /** "import a.b as c, d.e" -> [c, d]; "from a import (x as y, z)" -> [y, z] */
    static List<String> boundNames(String line) {
        List<String> names = new ArrayList<>();
        String list;
        if (line.startsWith("from ")) {
            int at = line.indexOf(" import ");
            if (at < 0) return names;
            list = line.substring(at + " import ".length()).replace("(", "").replace(")", "");
        } else if (line.startsWith("import ")) {
            list = line.substring("import ".length());
        } else {
            return names;
        }
        boolean plainImport = line.startsWith("import ");
        for (String part : list.split(",")) {
            String[] words = part.strip().split("\\s+");
            if (words.length == 0 || words[0].isEmpty()) continue;
            if (words.length >= 3 && words[1].equals("as")) {
                names.add(words[2]);
            } else if (plainImport) {
                int dot = words[0].indexOf('.');
                names.add(dot < 0 ? words[0] : words[0].substring(0, dot));
            } else {
                names.add(words[0]);
            }
        }
        return names;
    }

    private static void collectUses(Node s, Map<String, Integer> firstUse) {
        if (s.is(Node.Kind.COMMENT) || s.is(Node.Kind.BLANK)) return;
        if (s.body().isEmpty()) {
            scan(ScriptPrinter.statement(s, 0), s.line(), firstUse);
            return;
        }
        StringBuilder header = new StringBuilder();
        for (Node d : s.decorators()) header.append(ScriptPrinter.expression(d)).append('\n');
        for (Node c : s.children()) header.append(ScriptPrinter.expression(c)).append('\n');
        scan(header.toString(), s.line(), firstUse);
        for (Node b : s.body()) collectUses(b, firstUse);
    }

    private static void scan(String text, int line, Map<String, Integer> firstUse) {
        List<String> lines = PyText.lines(text);
        List<PyText.LineInfo> info = PyText.scan(lines);
        for (int i = 0; i < lines.size(); i++) {
            if (info.get(i).inString || PyText.isComment(lines.get(i))) continue;
            Matcher m = USE.matcher(PyText.mask(lines.get(i)));
            while (m.find()) firstUse.putIfAbsent(m.group(1), line);
        }
    }

    private static Node parse(String importLine) {
        try {
            return ScriptParser.parse(importLine + "\n").statements().get(0);
        } catch (ScriptParseException e) {
            throw new IllegalStateException("built-in import does not parse: " + importLine, e);
        }
    }
}
