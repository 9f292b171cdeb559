package com.initialone.jqport.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/** Static helpers over {@link Node} trees. */
public final class Nodes {

    private Nodes() {
    }

    /** 被调用者的点分名称：NAME -> "f"，ATTRIBUTE 链 -> "log.info"；其它形式返回 null */
    public static String dottedName(Node n) {
        if (n == null) return null;
        switch (n.kind()) {
            case NAME:
                return n.text();
            case ATTRIBUTE: {
                String base = dottedName(n.child(0));
                return base == null ? null : base + "." + n.text();
            }
            case SEQUENCE:
                return n.children().size() == 1 ? dottedName(n.child(0)) : null;
            default:
                return null;
        }
    }

    /** "log.info" -> ATTRIBUTE(NAME log, info) */
    public static Node dotted(String path, boolean spaceBefore) {
        String[] parts = path.split("\\.");
        Node cur = Node.name(parts[0], spaceBefore);
        for (int i = 1; i < parts.length; i++) {
            cur = Node.attribute(cur, parts[i]);
        }
        return cur;
    }

    /** Name declared by a parameter / positional argument: {@code x}, {@code x=1}; null for {@code *args}. */
    public static String argName(Node arg) {
        if (arg.text() != null) return arg.text();
        Node v = arg.child(0);
        if (v.is(Node.Kind.SEQUENCE) && v.children().size() == 1 && v.child(0).is(Node.Kind.NAME)) {
            return v.child(0).text();
        }
        if (v.is(Node.Kind.SEQUENCE) && !v.children().isEmpty() && v.child(0).is(Node.Kind.NAME)
                && v.children().size() >= 3 && v.child(1).is(Node.Kind.OPERATOR) && v.child(1).text().equals(":")) {
            return v.child(0).text();
        }
        return null;
    }

    /** Source text of an expression node, as the printer would render it. */
    public static String render(Node expr) {
        return ScriptPrinter.expression(expr);
    }

    public static boolean isPositional(Node arg) {
        if (arg.text() != null) return false;
        Node v = arg.child(0);
        return !(v.is(Node.Kind.SEQUENCE) && !v.children().isEmpty()
                && v.child(0).is(Node.Kind.OPERATOR)
                && (v.child(0).text().equals("*") || v.child(0).text().equals("**")));
    }

    public static List<Node> positional(Node call) {
        List<Node> out = new ArrayList<>();
        for (Node a : call.args()) {
            if (isPositional(a)) out.add(a);
        }
        return out;
    }

    public static Node keyword(Node call, String name) {
        for (Node a : call.args()) {
            if (name.equals(a.text())) return a;
        }
        return null;
    }

    /** 沿 ATTRIBUTE / CALL / SUBSCRIPT 链向下找到最内层、被调用者为纯点分名的调用 */
    public static Node rootCall(Node piece) {
        Node cur = piece;
        while (cur != null) {
            switch (cur.kind()) {
                case CALL:
                    if (dottedName(cur.child(0)) != null) return cur;
                    cur = cur.child(0);
                    break;
                case ATTRIBUTE:
                case SUBSCRIPT:
                    cur = cur.child(0);
                    break;
                default:
                    return null;
            }
        }
        return null;
    }

    /** Every node (statements and expressions) of the given kind, depth first, in source order. */
    public static List<Node> findAll(Node root, Node.Kind kind) {
        List<Node> out = new ArrayList<>();
        collect(root, n -> n.is(kind), out);
        return out;
    }

    public static List<Node> findAll(List<Node> roots, Node.Kind kind) {
        List<Node> out = new ArrayList<>();
        for (Node r : roots) collect(r, n -> n.is(kind), out);
        return out;
    }

    private static void collect(Node n, Predicate<Node> p, List<Node> out) {
        if (p.test(n)) out.add(n);
        for (Node d : n.decorators()) collect(d, p, out);
        for (Node c : n.children()) collect(c, p, out);
        for (Node b : n.body()) collect(b, p, out);
    }

    /**
     * Bottom-up copy transform: children are transformed first, then {@code fn} is applied to the
     * rebuilt node. Unchanged subtrees are shared, never mutated.
     */
    public static Node transform(Node n, UnaryOperator<Node> fn) {
        Node rebuilt = n;
        if (!n.decorators().isEmpty()) rebuilt = rebuilt.withDecorators(transformAll(n.decorators(), fn));
        if (!n.children().isEmpty()) rebuilt = rebuilt.withChildren(transformAll(n.children(), fn));
        if (!n.body().isEmpty()) rebuilt = rebuilt.withBody(transformAll(n.body(), fn));
        return fn.apply(rebuilt);
    }

    public static List<Node> transformAll(List<Node> in, UnaryOperator<Node> fn) {
        List<Node> out = new ArrayList<>(in.size());
        for (Node n : in) out.add(transform(n, fn));
        return out;
    }

    /** Renames every NAME reference {@code from} to {@code to}; attribute names and keywords are untouched. */
    public static Node renameReferences(Node root, String from, String to) {
        return transform(root, n -> n.is(Node.Kind.NAME) && from.equals(n.text()) ? n.withText(to) : n);
    }

    public static boolean references(Node root, String name) {
        for (Node n : findAll(root, Node.Kind.NAME)) {
            if (name.equals(n.text())) return true;
        }
        return false;
    }
}
