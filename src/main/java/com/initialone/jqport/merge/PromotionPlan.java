package com.initialone.jqport.merge;

import com.initialone.jqport.ast.CallSiteRewriter.ScheduleRegistration;
import com.initialone.jqport.ast.Node;
import com.initialone.jqport.ast.Nodes;
import com.initialone.jqport.model.Diagnostics;
import com.initialone.jqport.symbols.CallRule;
import com.initialone.jqport.symbols.SymbolTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which source functions are renamed into a lifecycle slot.
 *
 * <p>Two sources of candidates: naming patterns ({@code before_market_open} and friends), and the
 * callbacks of schedule registrations that the variant removed. Only one function can take the
 * periodic slot; the first candidate wins and every other one is reported.
 */
public final class PromotionPlan {

    /** 聚宽常见命名 -> 生命周期函数 */
    static final Map<String, String> LIFECYCLE_NAMES = Map.of(
            "before_market_open", "before_trading_start",
            "after_market_close", "after_trading_end");

    /** 常见的周期任务函数名 */
    static final List<String> PERIODIC_NAMES = List.of(
            "market_open", "weekly_adjustment", "monthly_adjustment", "market_trade");

    private final Map<String, String> renames;
    private final Set<String> scheduleCalls;

    private PromotionPlan(Map<String, String> renames, Set<String> scheduleCalls) {
        this.renames = Collections.unmodifiableMap(renames);
        this.scheduleCalls = Collections.unmodifiableSet(scheduleCalls);
    }

    public static PromotionPlan none() {
        return new PromotionPlan(new LinkedHashMap<>(), new LinkedHashSet<>());
    }

    public static PromotionPlan plan(ExtractedScript script, List<ScheduleRegistration> schedules,
                                     SymbolTable table, Diagnostics diagnostics) {
        Map<String, FunctionBody> functions = script.functions();
        Map<String, String> renames = new LinkedHashMap<>();

        for (String source : List.of("before_market_open", "after_market_close")) {
            String slot = LIFECYCLE_NAMES.get(source);
            if (functions.containsKey(source) && !functions.containsKey(slot)) {
                renames.put(source, slot);
                diagnostics.info(functions.get(source).line(), source + " promoted to lifecycle function " + slot);
            }
        }

        String slot = table.periodicSlot();
        if (slot != null) {
            Set<String> removedCallbacks = new LinkedHashSet<>();
            Set<String> keptCallbacks = new LinkedHashSet<>();
            for (ScheduleRegistration r : schedules) {
                if (r.callback == null) continue;
                if (r.removed) removedCallbacks.add(r.callback);
                else keptCallbacks.add(r.callback);
            }
            Set<String> candidates = new LinkedHashSet<>();
            for (String cb : removedCallbacks) {
                if (functions.containsKey(cb)) candidates.add(cb);
            }
            for (String name : functions.keySet()) {
                if (PERIODIC_NAMES.contains(name) && !keptCallbacks.contains(name)
                        && !stillReferenced(script, name)) {
                    candidates.add(name);
                }
            }
            candidates.removeAll(renames.keySet());

            if (functions.containsKey(slot)) {
                for (String c : candidates) {
                    if (!removedCallbacks.contains(c)) continue;
                    diagnostics.warning(functions.get(c).line(), c + " lost its schedule registration but " + slot
                            + " is already defined; " + c + " is kept as a helper and is no longer called");
                }
            } else if (!candidates.isEmpty()) {
                String first = candidates.iterator().next();
                renames.put(first, slot);
                diagnostics.info(functions.get(first).line(), first + " promoted to periodic lifecycle function " + slot);
                for (String c : candidates) {
                    if (c.equals(first)) continue;
                    diagnostics.warning(functions.get(c).line(), c + " also looks like a periodic task; " + first
                            + " was promoted to " + slot + " and " + c + " is kept as a helper"
                            + (removedCallbacks.contains(c) ? " that is no longer called" : ""));
                }
            }
        }

        Set<String> scheduleCalls = new LinkedHashSet<>();
        for (CallRule r : table.rules().values()) {
            if (!r.schedule) continue;
            scheduleCalls.add(r.source);
            if (!r.isRemoved()) scheduleCalls.add(r.target);
        }
        return new PromotionPlan(renames, scheduleCalls);
    }

    /** 按命名模式找到的候选：仍被其它代码调用或注册时不晋升 */
    private static boolean stillReferenced(ExtractedScript script, String name) {
        for (Node s : script.preamble()) {
            if (Nodes.references(s, name)) return true;
        }
        for (FunctionBody f : script.functions().values()) {
            if (!f.name().equals(name) && Nodes.references(f.definition(), name)) return true;
        }
        return false;
    }

    /** Old function name to the lifecycle slot it now fills. */
    public Map<String, String> renames() {
        return renames;
    }

    /** Call names that register a function for scheduled execution. */
    public Set<String> scheduleCalls() {
        return scheduleCalls;
    }

    public boolean isEmpty() {
        return renames.isEmpty();
    }
}
