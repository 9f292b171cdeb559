package com.initialone.jqport.symbols;

import com.initialone.jqport.ast.Node;
import com.initialone.jqport.ast.Nodes;
import com.initialone.jqport.ast.ScriptParser;
import com.initialone.jqport.ast.SyntaxTree;
import com.initialone.jqport.model.ConfigException;
import com.initialone.jqport.model.ScriptParseException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Target skeleton script. Its top-level functions named like the mandatory lifecycle functions are
 * the slots every output fills; any other top-level function is an optional helper slot that is
 * emitted only when the converted code calls it.
 *
 * Layout (classpath): /templates/&lt;name&gt;.py
 */
public final class StructuralTemplate {

    /** 目标平台必须存在的生命周期函数，按输出顺序 */
    public static final List<String> LIFECYCLE = List.of(
            "initialize", "before_trading_start", "handle_data", "after_trading_end");

    private final String name;
    private final List<Node> preamble;
    private final Map<String, Node> slots;
    private final Map<String, Node> helpers;

    StructuralTemplate(String name, SyntaxTree tree) {
        this.name = name;
        List<Node> pre = new ArrayList<>();
        Map<String, Node> s = new LinkedHashMap<>();
        Map<String, Node> h = new LinkedHashMap<>();
        for (Node stmt : tree.statements()) {
            if (stmt.is(Node.Kind.FUNCTION_DEF)) {
                if (LIFECYCLE.contains(stmt.text())) s.put(stmt.text(), stmt);
                else h.put(stmt.text(), stmt);
            } else if (s.isEmpty() && h.isEmpty()) {
                pre.add(stmt);
            }
        }
        for (String lifecycle : LIFECYCLE) {
            if (!s.containsKey(lifecycle)) {
                throw new IllegalStateException("template '" + name + "' lacks lifecycle function " + lifecycle);
            }
        }
        this.preamble = List.copyOf(pre);
        this.slots = Collections.unmodifiableMap(s);
        this.helpers = Collections.unmodifiableMap(h);
    }

    /** Loads and parses {@code /templates/<name>.py}. */
    public static StructuralTemplate load(String name) throws ConfigException {
        String resource = "/templates/" + name + ".py";
        try (InputStream in = StructuralTemplate.class.getResourceAsStream(resource)) {
            if (in == null) throw new ConfigException("template not found on classpath: " + resource);
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return new StructuralTemplate(name, ScriptParser.parse(text));
        } catch (IOException e) {
            throw new ConfigException("cannot read template " + resource, e);
        } catch (ScriptParseException e) {
            throw new ConfigException("template " + resource + " is not a valid script: " + e.getMessage(), e);
        }
    }

    public static boolean isLifecycle(String function) {
        return LIFECYCLE.contains(function);
    }

    public String name() {
        return name;
    }

    /** Comments and imports above the first template function. */
    public List<Node> preamble() {
        return preamble;
    }

    /** Mandatory lifecycle slots, in output order. */
    public Map<String, Node> slots() {
        return slots;
    }

    public Node slot(String lifecycle) {
        return slots.get(lifecycle);
    }

    public Map<String, Node> helpers() {
        return helpers;
    }

    /** Parameter names of a lifecycle slot, e.g. {@code [context, data]}. */
    public List<String> parameterNames(String lifecycle) {
        Node def = slots.get(lifecycle);
        if (def == null) throw new IllegalArgumentException("not a lifecycle slot: " + lifecycle);
        List<String> out = new ArrayList<>();
        for (Node p : def.params()) out.add(Nodes.argName(p));
        return out;
    }
}
