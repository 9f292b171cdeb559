package com.initialone.jqport.ast;

import com.initialone.jqport.model.Diagnostics;
import com.initialone.jqport.symbols.ArgFix;
import com.initialone.jqport.symbols.StructuralTemplate;
import com.initialone.jqport.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Threads the context parameter through helper functions once the global object has been
 * retargeted onto it.
 *
 * <p>A top-level, non-lifecycle function that uses {@code context} without declaring it, or that
 * calls such a function, gets {@code context} as its new first parameter, and every call to it gets
 * {@code context} as its new first argument. Computed to a fixpoint over the call graph.
 */
public final class ContextThreader {

    private ContextThreader() {
    }

    public static SyntaxTree thread(SyntaxTree tree, SymbolTable table, Diagnostics diagnostics) {
        String ctx = table.contextName();
        Map<String, Node> functions = new LinkedHashMap<>();
        for (Node s : tree.statements()) {
            if (s.is(Node.Kind.FUNCTION_DEF)) functions.put(s.text(), s);
        }

        Set<String> threaded = new LinkedHashSet<>();
        for (Node f : functions.values()) {
            if (candidate(f, ctx) && Nodes.references(bodyOf(f), ctx)) threaded.add(f.text());
        }
        boolean changed = !threaded.isEmpty();
        while (changed) {
            changed = false;
            for (Node f : functions.values()) {
                if (threaded.contains(f.text()) || !candidate(f, ctx)) continue;
                if (callsAny(bodyOf(f), threaded)) {
                    threaded.add(f.text());
                    changed = true;
                }
            }
        }
        if (threaded.isEmpty()) return tree;

        ArgFix leading = ArgFix.insertLeading(ctx);
        List<Node> out = new ArrayList<>();
        for (Node s : tree.statements()) {
            Node rewritten = Nodes.transform(s, n -> {
                if (n.is(Node.Kind.CALL) && threaded.contains(Nodes.dottedName(n.child(0)))) {
                    return leading.apply(n);
                }
                return n;
            });
            if (rewritten.is(Node.Kind.FUNCTION_DEF) && threaded.contains(rewritten.text())) {
                List<Node> params = new ArrayList<>(rewritten.children());
                params.add(0, Node.arg(null, Node.sequence(List.of(Node.name(ctx, false)), false)));
                rewritten = rewritten.withChildren(params);
                diagnostics.info(s.line(), "function " + s.text() + " now takes '" + ctx + "' as its first parameter");
            }
            out.add(rewritten);
        }
        return tree.withStatements(out);
    }

    private static boolean candidate(Node f, String ctx) {
        if (StructuralTemplate.isLifecycle(f.text())) return false;
        for (Node p : f.params()) {
            if (ctx.equals(Nodes.argName(p))) return false;
        }
        return true;
    }

    /** Function body wrapped so NAME lookups ignore the parameter list. */
    private static Node bodyOf(Node f) {
        return Node.module(f.body());
    }

    private static boolean callsAny(Node root, Set<String> names) {
        for (Node c : Nodes.findAll(root, Node.Kind.CALL)) {
            if (names.contains(Nodes.dottedName(c.child(0)))) return true;
        }
        return false;
    }
}
