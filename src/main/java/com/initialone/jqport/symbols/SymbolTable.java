package com.initialone.jqport.symbols;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Effective call table of one variant (built-in rules plus any override) together with the
 * variant's structural template and policy flags. Read-only once built; safe to share between
 * concurrent conversions.
 */
public final class SymbolTable {

    private final Variant variant;
    private final Map<String, CallRule> rules;
    private final StructuralTemplate template;
    private final boolean collapseSchedules;
    private final String periodicSlot;
    private final String globalObject;
    private final String contextName;
    private final Set<String> removedImports;
    private final Map<String, String> literalRewrites;
    private final List<String> registrationCalls;

    SymbolTable(Variant variant, Map<String, CallRule> rules, StructuralTemplate template, boolean collapseSchedules,
                String periodicSlot, String globalObject, String contextName, Set<String> removedImports,
                Map<String, String> literalRewrites, List<String> registrationCalls) {
        this.variant = variant;
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.template = template;
        this.collapseSchedules = collapseSchedules;
        this.periodicSlot = periodicSlot;
        this.globalObject = globalObject;
        this.contextName = contextName;
        this.removedImports = Collections.unmodifiableSet(new LinkedHashSet<>(removedImports));
        this.literalRewrites = Collections.unmodifiableMap(new LinkedHashMap<>(literalRewrites));
        this.registrationCalls = List.copyOf(registrationCalls);
        for (CallRule r : this.rules.values()) {
            if (!r.isRemoved() && this.rules.containsKey(r.target) && this.rules.get(r.target).isRemoved()) {
                throw new IllegalStateException(r.source + " maps to removed call " + r.target);
            }
        }
    }

    public Variant variant() {
        return variant;
    }

    /** Rule for a callee's dotted name, or null when the call is passed through untouched. */
    public CallRule rule(String callee) {
        return callee == null ? null : rules.get(callee);
    }

    public Map<String, CallRule> rules() {
        return rules;
    }

    /** CallMapping: source name to target name, removed calls excluded. */
    public Map<String, String> mapped() {
        Map<String, String> out = new LinkedHashMap<>();
        for (CallRule r : rules.values()) {
            if (!r.isRemoved()) out.put(r.source, r.target);
        }
        return out;
    }

    /** RemovedCallSet. */
    public Set<String> removed() {
        Set<String> out = new LinkedHashSet<>();
        for (CallRule r : rules.values()) {
            if (r.isRemoved()) out.add(r.source);
        }
        return out;
    }

    public StructuralTemplate template() {
        return template;
    }

    /** Whether run_weekly / run_monthly collapse onto the daily trigger (otherwise they are removed). */
    public boolean collapseSchedules() {
        return collapseSchedules;
    }

    /** Lifecycle function acting as the single periodic slot, or null when the variant has none. */
    public String periodicSlot() {
        return periodicSlot;
    }

    public String globalObject() {
        return globalObject;
    }

    public String contextName() {
        return contextName;
    }

    /** Top-level modules of the source platform whose imports are dropped. */
    public Set<String> removedImports() {
        return removedImports;
    }

    /** Substring rewrites applied inside string literals (security code suffixes). */
    public Map<String, String> literalRewrites() {
        return literalRewrites;
    }

    /** Target calls that register or configure something once; repeats are duplicates. */
    public List<String> registrationCalls() {
        return registrationCalls;
    }
}
