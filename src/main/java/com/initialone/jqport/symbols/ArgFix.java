package com.initialone.jqport.symbols;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.initialone.jqport.ast.Node;
import com.initialone.jqport.ast.Nodes;
import com.initialone.jqport.util.PyText;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One argument-shape correction applied to a rewritten call. The set of operations is closed;
 * variant tables refer to them by {@link Op} name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ArgFix {

    public enum Op {
        insertLeading, dropPositional, dropKeyword, renameKeyword, positionalToKeyword, reorder, mapKeywordValue
    }

    public final Op op;
    public final String value;
    public final Integer index;
    public final String name;
    public final String to;
    public final int[] order;
    public final Map<String, String> values;

    private ArgFix(Op op, String value, Integer index, String name, String to, int[] order, Map<String, String> values) {
        this.op = op;
        this.value = value;
        this.index = index;
        this.name = name;
        this.to = to;
        this.order = order;
        this.values = values;
    }

    public static ArgFix insertLeading(String value) {
        return new ArgFix(Op.insertLeading, value, null, null, null, null, null);
    }

    public static ArgFix dropPositional(int index) {
        return new ArgFix(Op.dropPositional, null, index, null, null, null, null);
    }

    public static ArgFix dropKeyword(String name) {
        return new ArgFix(Op.dropKeyword, null, null, name, null, null, null);
    }

    public static ArgFix renameKeyword(String from, String to) {
        return new ArgFix(Op.renameKeyword, null, null, from, to, null, null);
    }

    public static ArgFix positionalToKeyword(int index, String name) {
        return new ArgFix(Op.positionalToKeyword, null, index, name, null, null, null);
    }

    public static ArgFix reorder(int... permutation) {
        return new ArgFix(Op.reorder, null, null, null, null, permutation.clone(), null);
    }

    /**
     * Maps literal string values of keyword {@code name}; when {@code index} is given the positional
     * argument at that index is mapped as well.
     */
    public static ArgFix mapKeywordValue(String name, Integer index, Map<String, String> values) {
        return new ArgFix(Op.mapKeywordValue, null, index, name, null, null, new LinkedHashMap<>(values));
    }

    /** Returns a rewritten copy of {@code call}; a fix that does not apply returns the call unchanged. */
    public Node apply(Node call) {
        if (!call.is(Node.Kind.CALL)) throw new IllegalArgumentException("not a call: " + call);
        List<Node> args = new ArrayList<>(call.args());
        switch (op) {
            case insertLeading: {
                if (leadingEquals(call)) return call;
                args.add(0, Node.arg(null, Node.sequence(List.of(Nodes.dotted(value, false)), false)));
                break;
            }
            case dropPositional: {
                Node target = positionalAt(args, index);
                if (target == null) return call;
                args.remove(target);
                break;
            }
            case dropKeyword: {
                if (!args.removeIf(a -> name.equals(a.text()))) return call;
                break;
            }
            case renameKeyword: {
                boolean changed = false;
                for (int i = 0; i < args.size(); i++) {
                    if (name.equals(args.get(i).text())) {
                        args.set(i, args.get(i).withText(to));
                        changed = true;
                    }
                }
                if (!changed) return call;
                break;
            }
            case positionalToKeyword: {
                Node target = positionalAt(args, index);
                if (target == null) return call;
                args.remove(target);
                args.add(Node.arg(name, target.child(0)));
                break;
            }
            case reorder: {
                List<Node> pos = new ArrayList<>();
                for (Node a : args) if (Nodes.isPositional(a)) pos.add(a);
                if (pos.size() != order.length) return call;
                List<Node> rest = new ArrayList<>(args);
                rest.removeAll(pos);
                List<Node> out = new ArrayList<>();
                for (int i : order) out.add(pos.get(i));
                out.addAll(rest);
                args = out;
                break;
            }
            case mapKeywordValue: {
                boolean changed = false;
                for (int i = 0; i < args.size(); i++) {
                    Node a = args.get(i);
                    boolean hit = name.equals(a.text()) || (index != null && a == positionalAt(args, index));
                    if (!hit) continue;
                    Node mapped = mapValue(a);
                    if (mapped != a) {
                        args.set(i, mapped);
                        changed = true;
                    }
                }
                if (!changed) return call;
                break;
            }
            default:
                throw new IllegalStateException("unhandled fix " + op);
        }
        return call.withChildren(withCallee(call.child(0), args));
    }

    private Node mapValue(Node arg) {
        Node v = arg.child(0);
        if (!v.is(Node.Kind.SEQUENCE) || v.children().size() != 1 || !v.child(0).is(Node.Kind.LITERAL)) return arg;
        String literal = v.child(0).text();
        String content = PyText.stringContent(literal);
        if (content == null || !values.containsKey(content)) return arg;
        String quote = literal.endsWith("\"") ? "\"" : "'";
        Node replaced = Node.literal(quote + values.get(content) + quote, v.child(0).spaceBefore());
        return Node.arg(arg.text(), Node.sequence(List.of(replaced), v.spaceBefore()));
    }

    private boolean leadingEquals(Node call) {
        List<Node> pos = Nodes.positional(call);
        if (pos.isEmpty()) return false;
        return value.equals(Nodes.render(pos.get(0).child(0)));
    }

    private static Node positionalAt(List<Node> args, int index) {
        int seen = 0;
        for (Node a : args) {
            if (!Nodes.isPositional(a)) continue;
            if (seen == index) return a;
            seen++;
        }
        return null;
    }

    private static List<Node> withCallee(Node callee, List<Node> args) {
        List<Node> all = new ArrayList<>(args.size() + 1);
        all.add(callee);
        all.addAll(args);
        return all;
    }

    @Override
    public String toString() {
        switch (op) {
            case insertLeading:
                return op + "(" + value + ")";
            case dropPositional:
                return op + "(" + index + ")";
            case dropKeyword:
                return op + "(" + name + ")";
            case renameKeyword:
                return op + "(" + name + "->" + to + ")";
            case positionalToKeyword:
                return op + "(" + index + "->" + name + ")";
            case reorder:
                return op + Arrays.toString(order);
            default:
                return op + "(" + name + values + ")";
        }
    }
}
