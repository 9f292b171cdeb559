package com.initialone.jqport.merge;

import com.initialone.jqport.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source script split into its module preamble (imports, constants, classes, top-level code) and
 * its top-level functions.
 */
public final class ExtractedScript {
    private final List<Node> preamble;
    private final List<FunctionBody> definitions;

    ExtractedScript(List<Node> preamble, List<FunctionBody> definitions) {
        this.preamble = List.copyOf(preamble);
        this.definitions = List.copyOf(definitions);
    }

    public List<Node> preamble() {
        return preamble;
    }

    /** Every top-level definition in source order, including ones redefined later. */
    public List<FunctionBody> definitions() {
        return definitions;
    }

    /** Functions keyed by name; a later definition replaces an earlier one but keeps its position. */
    public Map<String, FunctionBody> functions() {
        Map<String, FunctionBody> out = new LinkedHashMap<>();
        for (FunctionBody f : definitions) out.put(f.name(), f);
        return Collections.unmodifiableMap(out);
    }

    /** Definitions hidden by a later definition of the same name. */
    public List<FunctionBody> overridden() {
        Map<String, FunctionBody> last = functions();
        List<FunctionBody> out = new ArrayList<>();
        for (FunctionBody f : definitions) {
            if (last.get(f.name()) != f) out.add(f);
        }
        return out;
    }
}
