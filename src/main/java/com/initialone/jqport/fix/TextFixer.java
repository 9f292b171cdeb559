package com.initialone.jqport.fix;

import com.initialone.jqport.symbols.StructuralTemplate;
import com.initialone.jqport.symbols.SymbolTable;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Ordered post-pass over the merged script text:
 * dedupe, delimiter repair, indentation, lifecycle check, review markers.
 */
public final class TextFixer {

    private final List<FixPass> passes;

    public TextFixer(List<FixPass> passes) {
        this.passes = List.copyOf(passes);
    }

    /** The standard five passes, configured from a variant's table and template. */
    public static TextFixer forTable(SymbolTable table) {
        Map<String, String> lifecycle = new LinkedHashMap<>();
        StructuralTemplate template = table.template();
        for (String name : StructuralTemplate.LIFECYCLE) {
            lifecycle.put(name, String.join(", ", template.parameterNames(name)));
        }
        return new TextFixer(List.of(
                new DuplicateStatementPass(new LinkedHashSet<>(table.registrationCalls())),
                new DelimiterRepairPass(),
                new IndentationPass(),
                new LifecycleCheckPass(lifecycle),
                new ReviewMarkerPass(table.removed())));
    }

    public String fix(String text) {
        String out = text;
        for (FixPass pass : passes) {
            out = pass.apply(out);
        }
        return out;
    }

    public List<FixPass> passes() {
        return passes;
    }
}
