package com.initialone.jqport.merge;

import com.initialone.jqport.ast.Node;
import com.initialone.jqport.ast.Nodes;
import com.initialone.jqport.ast.ScriptPrinter;
import com.initialone.jqport.model.Diagnostics;
import com.initialone.jqport.symbols.StructuralTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splices extracted source functions into a {@link StructuralTemplate}.
 *
 * <p>Output order: template preamble, source preamble, the lifecycle slots (source body or the
 * template's empty body), referenced template helpers, then the remaining source functions in
 * source order. Imports for module aliases that placeholders introduce are added after the
 * template preamble.
 */
public final class TemplateMerger {

    private TemplateMerger() {
    }

    public static String merge(StructuralTemplate template, ExtractedScript script, PromotionPlan plan,
                               Diagnostics diagnostics) {
        return ScriptPrinter.print(Node.module(mergeStatements(template, script, plan, diagnostics)));
    }

    static List<Node> mergeStatements(StructuralTemplate template, ExtractedScript script, PromotionPlan plan,
                                      Diagnostics diagnostics) {
        for (FunctionBody hidden : script.overridden()) {
            FunctionBody winner = script.functions().get(hidden.name());
            diagnostics.warning(hidden.line(), "function " + hidden.name() + " is defined again at line "
                    + winner.line() + "; the later definition is used");
        }

        // 1. 晋升：去掉已晋升函数的定时注册，再统一改名
        Map<String, FunctionBody> functions = new LinkedHashMap<>();
        for (FunctionBody f : script.functions().values()) {
            Node def = stripRegistrations(f.definition(), plan, diagnostics);
            String newName = plan.renames().get(f.name());
            if (newName != null) def = def.withText(newName);
            def = renameAll(def, plan);
            functions.put(def.text(), f.withDefinition(def));
        }
        List<Node> preamble = new ArrayList<>();
        for (Node s : script.preamble()) {
            Node kept = stripRegistrations(s, plan, diagnostics);
            if (kept != null) preamble.add(renameAll(kept, plan));
        }

        // 2. 生命周期函数签名与模板对齐
        for (String slot : StructuralTemplate.LIFECYCLE) {
            FunctionBody f = functions.get(slot);
            if (f != null) functions.put(slot, f.withDefinition(resign(f.definition(), template, diagnostics)));
        }

        // 3. 拼装
        List<Node> out = new ArrayList<>(template.preamble());
        List<Node> sourceOwned = new ArrayList<>();
        Set<String> templateLines = new HashSet<>();
        for (Node s : template.preamble()) {
            if (!s.is(Node.Kind.BLANK)) templateLines.add(ScriptPrinter.statement(s, 0));
        }
        for (Node s : preamble) {
            if (!s.is(Node.Kind.BLANK) && templateLines.contains(ScriptPrinter.statement(s, 0))) continue;
            out.add(s);
            sourceOwned.add(s);
        }
        for (String slot : StructuralTemplate.LIFECYCLE) {
            FunctionBody f = functions.remove(slot);
            if (f != null) {
                out.addAll(f.leadingComments());
                out.add(f.definition());
                sourceOwned.add(f.definition());
            } else {
                out.add(template.slot(slot));
            }
        }
        for (Map.Entry<String, Node> helper : template.helpers().entrySet()) {
            FunctionBody f = functions.remove(helper.getKey());
            if (f != null) {
                out.addAll(f.leadingComments());
                out.add(f.definition());
                sourceOwned.add(f.definition());
            } else if (referenced(helper.getKey(), out, functions)) {
                out.add(helper.getValue());
            }
        }
        for (FunctionBody f : functions.values()) {
            out.addAll(f.leadingComments());
            out.add(f.definition());
            sourceOwned.add(f.definition());
        }

        // 4. 占位符可能引入 pd/np/datetime，补齐缺失的 import
        List<Node> imports = MissingImports.find(out, sourceOwned, diagnostics);
        if (!imports.isEmpty()) out.addAll(importPosition(template), imports);
        return out;
    }

    /** Removes schedule registrations of functions that now run as a lifecycle slot. */
    private static Node stripRegistrations(Node root, PromotionPlan plan, Diagnostics diagnostics) {
        if (plan.isEmpty()) return root;
        if (isRegistrationOfPromoted(root, plan)) {
            diagnostics.info(root.line(), "schedule registration removed, the function now runs as a lifecycle function: "
                    + ScriptPrinter.statement(root, 0).strip());
            return null;
        }
        if (root.body().isEmpty()) return root;
        List<Node> body = new ArrayList<>();
        for (Node s : root.body()) {
            Node kept = stripRegistrations(s, plan, diagnostics);
            if (kept != null) body.add(kept);
        }
        return root.withBody(body);
    }

    private static boolean isRegistrationOfPromoted(Node s, PromotionPlan plan) {
        if (!s.is(Node.Kind.EXPR_STMT) || s.child(0).children().size() != 1) return false;
        Node call = s.child(0).child(0);
        if (!call.is(Node.Kind.CALL) || !plan.scheduleCalls().contains(Nodes.dottedName(call.child(0)))) return false;
        for (Node a : Nodes.positional(call)) {
            if (plan.renames().containsKey(Nodes.argName(a))) return true;
        }
        return false;
    }

    private static Node renameAll(Node n, PromotionPlan plan) {
        if (n == null) return null;
        Node out = n;
        for (Map.Entry<String, String> e : plan.renames().entrySet()) {
            out = Nodes.renameReferences(out, e.getKey(), e.getValue());
        }
        return out;
    }

    /**
     * Gives a source lifecycle function the template's parameter list; parameters named differently
     * in the source are renamed throughout the body.
     */
    private static Node resign(Node def, StructuralTemplate template, Diagnostics diagnostics) {
        List<String> wanted = template.parameterNames(def.text());
        List<Node> params = def.params();
        List<String> have = new ArrayList<>();
        for (Node p : params) have.add(Nodes.argName(p));
        if (have.equals(wanted)) return def;

        List<Node> body = def.body();
        List<String> renamed = new ArrayList<>();
        for (int i = 0; i < Math.min(have.size(), wanted.size()); i++) {
            String from = have.get(i);
            String to = wanted.get(i);
            if (from == null || from.equals(to)) continue;
            List<Node> next = new ArrayList<>(body.size());
            for (Node s : body) next.add(Nodes.renameReferences(s, from, to));
            body = next;
            renamed.add(from + " -> " + to);
        }
        Node slot = template.slot(def.text());
        List<Node> children = new ArrayList<>(slot.params());
        diagnostics.info(def.line(), def.text() + " re-signed to (" + String.join(", ", wanted) + ")"
                + (renamed.isEmpty() ? "" : ", parameters renamed: " + String.join(", ", renamed)));
        return def.withChildren(children).withBody(body);
    }

    /** Right after the template preamble's last non-blank line. */
    private static int importPosition(StructuralTemplate template) {
        List<Node> preamble = template.preamble();
        int at = preamble.size();
        while (at > 0 && preamble.get(at - 1).is(Node.Kind.BLANK)) at--;
        return at;
    }

    private static boolean referenced(String name, List<Node> emitted, Map<String, FunctionBody> pending) {
        for (Node s : emitted) {
            if (Nodes.references(s, name)) return true;
        }
        for (FunctionBody f : pending.values()) {
            if (Nodes.references(f.definition(), name)) return true;
        }
        return false;
    }
}
