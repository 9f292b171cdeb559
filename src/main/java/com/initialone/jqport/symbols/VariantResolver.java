package com.initialone.jqport.symbols;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jqport.model.ConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves a {@link Variant} to its effective {@link SymbolTable}: the built-in JSON table (with its
 * {@code inherits} chain), the structural template, and an optional mapping-override file.
 *
 * <p>Override file format: a flat JSON object {@code {"call_name": "target_name" | null}}; null
 * removes the call. Entries absent from it fall back to the built-in table.
 */
public class VariantResolver {

    private static final Pattern DOTTED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final ObjectMapper om = new ObjectMapper();

    public SymbolTable resolve(Variant variant) throws ConfigException {
        return resolve(variant, null);
    }

    /**
     * @param mappingOverride override file, or null
     * @throws ConfigException when a table, template or the override file cannot be used
     */
    public SymbolTable resolve(Variant variant, Path mappingOverride) throws ConfigException {
        // 先读 override：格式错误要在解析脚本之前报出来
        Map<String, String> override = mappingOverride == null ? Map.of() : readOverride(mappingOverride);

        Deque<VariantDefinition> chain = new ArrayDeque<>();
        Set<String> seen = new LinkedHashSet<>();
        String id = variant.id();
        while (id != null) {
            if (!seen.add(id)) throw new ConfigException("variant inheritance cycle: " + seen);
            VariantDefinition def = loadDefinition(id);
            chain.push(def);
            id = def.inherits;
        }

        // 从根变体往下叠加
        Map<String, CallRule> rules = new LinkedHashMap<>();
        String template = null;
        boolean collapse = false;
        String periodic = null;
        String globalObject = "g";
        String contextName = "context";
        Set<String> removedImports = new LinkedHashSet<>();
        Map<String, String> literals = new LinkedHashMap<>();
        Set<String> registrations = new LinkedHashSet<>();
        while (!chain.isEmpty()) {
            VariantDefinition def = chain.pop();
            if (def.template != null) template = def.template;
            if (def.collapseSchedules != null) collapse = def.collapseSchedules;
            if (def.periodicSlot != null) periodic = def.periodicSlot.isEmpty() ? null : def.periodicSlot;
            if (def.globalObject != null) globalObject = def.globalObject;
            if (def.contextName != null) contextName = def.contextName;
            if (def.removedImports != null) removedImports.addAll(def.removedImports);
            if (def.literalRewrites != null) literals.putAll(def.literalRewrites);
            if (def.registrationCalls != null) registrations.addAll(def.registrationCalls);
            for (Map.Entry<String, VariantDefinition.RuleDefinition> e : def.calls.entrySet()) {
                VariantDefinition.RuleDefinition rd = e.getValue();
                if (rd.passThrough) {
                    rules.remove(e.getKey());
                } else {
                    rules.put(e.getKey(), toRule(e.getKey(), rd));
                }
            }
        }
        if (template == null) throw new ConfigException("variant " + variant + " names no template");
        if (periodic != null && !StructuralTemplate.isLifecycle(periodic)) {
            throw new ConfigException("variant " + variant + ": periodic slot " + periodic + " is not a lifecycle function");
        }

        for (Map.Entry<String, String> e : override.entrySet()) {
            CallRule builtIn = rules.get(e.getKey());
            String target = e.getValue();
            CallRule rule;
            if (target == null) {
                rule = builtIn != null && builtIn.isRemoved()
                        ? builtIn
                        : CallRule.removed(e.getKey(), "None", builtIn != null && builtIn.schedule, null);
            } else if (builtIn != null && target.equals(builtIn.target)) {
                rule = builtIn;
            } else {
                rule = CallRule.mapped(e.getKey(), target, List.of(), false, null);
            }
            rules.put(e.getKey(), rule);
        }
        for (CallRule r : rules.values()) {
            if (!r.isRemoved() && rules.containsKey(r.target) && rules.get(r.target).isRemoved()) {
                throw new ConfigException("call " + r.source + " maps to " + r.target + ", which is itself removed");
            }
        }

        StructuralTemplate tpl = StructuralTemplate.load(template);
        return new SymbolTable(variant, rules, tpl, collapse, periodic, globalObject, contextName,
                removedImports, literals, new ArrayList<>(registrations));
    }

    /** Reads a mapping-override file; see class doc for the format. */
    public Map<String, String> readOverride(Path file) throws ConfigException {
        JsonNode root;
        try {
            root = om.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new ConfigException("malformed mapping override " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("cannot read mapping override " + file + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("mapping override " + file + " must be a JSON object of call_name -> target_name");
        }
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            JsonNode v = e.getValue();
            if (!DOTTED.matcher(key).matches()) {
                throw new ConfigException("mapping override " + file + ": invalid call name '" + key + "'");
            }
            if (v.isNull()) {
                out.put(key, null);
            } else if (v.isTextual() && DOTTED.matcher(v.asText()).matches()) {
                out.put(key, v.asText());
            } else {
                throw new ConfigException("mapping override " + file + ": target of '" + key
                        + "' must be a call name or null, got " + v);
            }
        }
        return out;
    }

    private VariantDefinition loadDefinition(String id) throws ConfigException {
        String resource = "/variants/" + id + ".json";
        try (InputStream in = VariantResolver.class.getResourceAsStream(resource)) {
            if (in == null) throw new ConfigException("no built-in table for variant '" + id + "'");
            return om.readValue(in, VariantDefinition.class);
        } catch (IOException e) {
            throw new ConfigException("broken built-in table " + resource + ": " + e.getMessage(), e);
        }
    }

    private static CallRule toRule(String source, VariantDefinition.RuleDefinition rd) throws ConfigException {
        if (rd.remove == (rd.target != null)) {
            throw new ConfigException("rule " + source + " must have exactly one of target / remove");
        }
        if (rd.remove) return CallRule.removed(source, rd.placeholder, rd.schedule, rd.warning);
        List<ArgFix> fixes = new ArrayList<>();
        for (VariantDefinition.FixDefinition fd : rd.fixes) fixes.add(toFix(source, fd));
        return CallRule.mapped(source, rd.target, fixes, rd.schedule, rd.warning);
    }

    private static ArgFix toFix(String source, VariantDefinition.FixDefinition fd) throws ConfigException {
        ArgFix.Op op;
        try {
            op = ArgFix.Op.valueOf(fd.op);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException("rule " + source + ": unknown argument fix '" + fd.op + "'");
        }
        switch (op) {
            case insertLeading:
                return ArgFix.insertLeading(require(source, op, fd.value));
            case dropPositional:
                return ArgFix.dropPositional(require(source, op, fd.index));
            case dropKeyword:
                return ArgFix.dropKeyword(require(source, op, fd.name));
            case renameKeyword:
                return ArgFix.renameKeyword(require(source, op, fd.from), require(source, op, fd.to));
            case positionalToKeyword:
                return ArgFix.positionalToKeyword(require(source, op, fd.index), require(source, op, fd.name));
            case reorder:
                return ArgFix.reorder(require(source, op, fd.order));
            case mapKeywordValue:
                return ArgFix.mapKeywordValue(require(source, op, fd.name), fd.index, require(source, op, fd.values));
            default:
                throw new IllegalStateException("unhandled fix " + op);
        }
    }

    private static <T> T require(String source, ArgFix.Op op, T value) throws ConfigException {
        if (value == null) throw new ConfigException("rule " + source + ": fix " + op + " is missing an argument");
        return value;
    }
}
