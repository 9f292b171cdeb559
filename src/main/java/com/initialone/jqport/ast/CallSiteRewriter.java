package com.initialone.jqport.ast;

import com.initialone.jqport.model.Diagnostics;
import com.initialone.jqport.symbols.ArgFix;
import com.initialone.jqport.symbols.CallRule;
import com.initialone.jqport.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a {@link SymbolTable} to every call site of a tree.
 *
 * <ul>
 *   <li>mapped call: callee renamed, declared argument fixes applied in order</li>
 *   <li>removed call used as a statement: statement turned into a review comment</li>
 *   <li>removed call whose value is used: replaced by the rule's placeholder, warning recorded</li>
 *   <li>unknown call: untouched</li>
 * </ul>
 * Also retargets the shared global object onto the context parameter, rewrites security-code
 * suffixes inside string literals and drops source-platform imports. The input tree is never
 * modified; a new tree is returned.
 */
public final class CallSiteRewriter {

    /** A schedule-registration call seen during the walk. */
    public static final class ScheduleRegistration {
        public final String call;
        /** 回调函数名；回调不是普通名字（lambda 等）时为 null */
        public final String callback;
        public final int line;
        public final boolean removed;

        ScheduleRegistration(String call, String callback, int line, boolean removed) {
            this.call = call;
            this.callback = callback;
            this.line = line;
            this.removed = removed;
        }

        @Override
        public String toString() {
            return call + "(" + callback + ")@" + line;
        }
    }

    public static final class RewriteResult {
        private final SyntaxTree tree;
        private final List<ScheduleRegistration> schedules;

        RewriteResult(SyntaxTree tree, List<ScheduleRegistration> schedules) {
            this.tree = tree;
            this.schedules = List.copyOf(schedules);
        }

        public SyntaxTree tree() {
            return tree;
        }

        public List<ScheduleRegistration> schedules() {
            return schedules;
        }
    }

    private static final Pattern FSTRING_FIELD = Pattern.compile("\\{([^{}]*)}");

    private final SymbolTable table;
    private final Diagnostics diagnostics;
    private final List<ScheduleRegistration> schedules = new ArrayList<>();
    private final Pattern globalRef;

    private int line;
    private boolean globalBound;
    /** 当前所在类的名字；不在类体内时为 null */
    private String enclosingClass;

    private CallSiteRewriter(SymbolTable table, Diagnostics diagnostics) {
        this.table = table;
        this.diagnostics = diagnostics;
        this.globalRef = Pattern.compile("(?<![\\w.])" + Pattern.quote(table.globalObject()) + "\\.");
    }

    public static RewriteResult rewrite(SyntaxTree tree, SymbolTable table, Diagnostics diagnostics) {
        CallSiteRewriter r = new CallSiteRewriter(table, diagnostics);
        List<Node> body = r.block(tree.statements(), true);
        return new RewriteResult(tree.withStatements(body), r.schedules);
    }

    /* ======================= 语句 ======================= */

    private List<Node> block(List<Node> statements, boolean moduleLevel) {
        List<Node> out = new ArrayList<>();
        for (Node s : statements) out.addAll(statement(s, moduleLevel));
        return out;
    }

    private List<Node> statement(Node s, boolean moduleLevel) {
        line = s.line();
        switch (s.kind()) {
            case FUNCTION_DEF: {
                boolean saved = globalBound;
                // 默认值在外层作用域求值，先于参数绑定改写
                List<Node> params = new ArrayList<>(s.children().size());
                for (Node p : s.children()) {
                    params.add(p.is(Node.Kind.ARG) && p.text() != null ? p.withChildren(expressions(p.children())) : p);
                }
                checkedDefaults(s, moduleLevel);
                for (Node p : s.params()) {
                    if (table.globalObject().equals(Nodes.argName(p))) globalBound = true;
                }
                List<Node> decorators = expressions(s.decorators());
                List<Node> body = block(s.body(), false);
                globalBound = saved;
                return List.of(s.withChildren(params).withDecorators(decorators).withBody(body));
            }
            case CLASS_DEF: {
                List<Node> bases = expressions(s.children());
                List<Node> decorators = expressions(s.decorators());
                String saved = enclosingClass;
                enclosingClass = s.text();
                List<Node> body = block(s.body(), false);
                enclosingClass = saved;
                return List.of(s.withChildren(bases).withDecorators(decorators).withBody(body));
            }
            case COMPOUND: {
                Node rewritten = s;
                if (!s.children().isEmpty()) {
                    checked(s.line(), s.child(0), moduleLevel);
                    rewritten = s.withChildren(List.of(expression(s.child(0))));
                }
                // if / for / while 不开新作用域
                List<Node> body = block(s.body(), moduleLevel);
                return List.of(rewritten.withBody(body));
            }
            case SIMPLE_STMT:
                return simple(s, moduleLevel);
            case ASSIGN:
                return assign(s, moduleLevel);
            case EXPR_STMT:
                return exprStatement(s, moduleLevel);
            default:
                return List.of(s);
        }
    }

    private List<Node> simple(Node s, boolean moduleLevel) {
        String kw = s.text();
        if (kw.equals("import") || kw.equals("from")) return importStatement(s);
        if (kw.equals("global") || kw.equals("nonlocal")) return globalStatement(s);
        if (s.children().isEmpty()) return List.of(s);
        return List.of(checked(s, s.withChildren(List.of(expression(s.child(0)))), moduleLevel));
    }

    private List<Node> assign(Node s, boolean moduleLevel) {
        List<Node> parts = s.children();
        // 赋值目标里出现被移除的调用：无法安全替换，整行禁用
        for (int i = 0; i < parts.size() - 1; i++) {
            String removed = removedCallIn(parts.get(i));
            if (removed != null) {
                String original = ScriptPrinter.statement(s, 0).strip();
                diagnostics.blocked(s.line(), "removed call " + removed + " appears in an assignment target; line disabled: "
                        + original);
                return List.of(reviewComment(s, "blocked " + removed + ": " + original));
            }
        }
        List<Node> rewritten = new ArrayList<>(parts.size());
        for (Node p : parts) rewritten.add(expression(p));
        return List.of(checked(s, s.withChildren(rewritten), moduleLevel));
    }

    private List<Node> exprStatement(Node s, boolean moduleLevel) {
        Node seq = s.child(0);
        if (seq.children().size() == 1) {
            Node root = Nodes.rootCall(seq.child(0));
            CallRule rule = root == null ? null : table.rule(Nodes.dottedName(root.child(0)));
            if (rule != null && rule.isRemoved()) {
                if (rule.schedule) recordSchedule(rule, root, true);
                String original = ScriptPrinter.statement(s, 0).strip();
                String message = rule.warning != null ? rule.warning
                        : "removed " + rule.source + " (no PTrade equivalent): " + original;
                if (rule.warning != null) diagnostics.warning(s.line(), message);
                else diagnostics.info(s.line(), message);
                return List.of(reviewComment(s, "removed " + rule.source + ": " + original));
            }
        }
        return List.of(checked(s, s.withChildren(List.of(expression(seq))), moduleLevel));
    }

    /**
     * Records a warning for uses of the global object where no context parameter exists: at module
     * level, and inside class bodies, whose methods never receive the context.
     */
    private Node checked(Node original, Node rewritten, boolean moduleLevel) {
        checked(original.line(), original, moduleLevel);
        return rewritten;
    }

    private void checked(int at, Node original, boolean moduleLevel) {
        if (globalBound || !Nodes.references(original, table.globalObject())) return;
        if (enclosingClass != null) {
            diagnostics.warning(at, "use of '" + table.globalObject() + "' inside class "
                    + enclosingClass + " retargeted to '" + table.contextName()
                    + "', which its methods do not receive; pass it in by hand");
        } else if (moduleLevel) {
            diagnostics.warning(at, "module-level use of '" + table.globalObject()
                    + "' retargeted to '" + table.contextName() + "', which is only defined inside functions");
        }
    }

    /** Parameter defaults are evaluated where the def statement runs. */
    private void checkedDefaults(Node def, boolean moduleLevel) {
        for (Node p : def.children()) {
            if (p.is(Node.Kind.ARG) && p.text() != null) checked(def.line(), p, moduleLevel);
        }
    }

    private List<Node> importStatement(Node s) {
        if (s.children().isEmpty()) return List.of(s);
        List<String> modules = importedModules(s);
        int dropped = 0;
        for (String m : modules) {
            String top = m.contains(".") ? m.substring(0, m.indexOf('.')) : m;
            if (table.removedImports().contains(top)) dropped++;
        }
        if (dropped == 0) return List.of(s);
        String original = ScriptPrinter.statement(s, 0).strip();
        if (dropped == modules.size()) {
            diagnostics.info(s.line(), "removed source-platform import: " + original);
            return List.of(reviewComment(s, "removed import: " + original));
        }
        diagnostics.warning(s.line(), "import mixes source-platform and other modules; line disabled: " + original);
        return List.of(reviewComment(s, "removed import: " + original));
    }

    /** "import a.b as c, d" -> [a.b, d]; "from a.b import x" -> [a.b] */
    private static List<String> importedModules(Node s) {
        List<String> out = new ArrayList<>();
        List<Node> pieces = s.child(0).children();
        boolean expectName = true;
        for (Node p : pieces) {
            if (p.is(Node.Kind.OPERATOR)) {
                if (s.text().equals("from") && p.text().equals("import")) break;
                if (p.text().equals(",")) expectName = true;
                continue;
            }
            if (expectName) {
                String name = Nodes.dottedName(p);
                if (name != null) out.add(name);
                expectName = false;
            }
        }
        return out;
    }

    private List<Node> globalStatement(Node s) {
        if (s.children().isEmpty()) return List.of(s);
        List<Node> kept = new ArrayList<>();
        boolean dropped = false;
        for (Node p : s.child(0).children()) {
            if (p.is(Node.Kind.NAME) && p.text().equals(table.globalObject())) {
                dropped = true;
                continue;
            }
            if (p.is(Node.Kind.OPERATOR) && p.text().equals(",")) continue;
            kept.add(p);
        }
        if (!dropped) return List.of(s);
        if (kept.isEmpty()) return List.of();
        List<Node> pieces = new ArrayList<>();
        for (int i = 0; i < kept.size(); i++) {
            if (i > 0) pieces.add(Node.operator(",", false));
            pieces.add(kept.get(i).withSpaceBefore(i > 0));
        }
        return List.of(s.withChildren(List.of(Node.sequence(pieces, false))));
    }

    private static Node reviewComment(Node s, String text) {
        return Node.comment(s.line(), ScriptPrinter.REVIEW_MARK + " " + text.replace('\n', ' '));
    }

    /* ======================= 表达式 ======================= */

    private List<Node> expressions(List<Node> in) {
        List<Node> out = new ArrayList<>(in.size());
        for (Node n : in) out.add(expression(n));
        return out;
    }

    private Node expression(Node n) {
        switch (n.kind()) {
            case SEQUENCE: {
                List<Node> pieces = new ArrayList<>(n.children().size());
                for (Node piece : n.children()) pieces.add(piece(piece));
                return n.withChildren(pieces);
            }
            case NAME:
                if (!globalBound && n.text().equals(table.globalObject())) return n.withText(table.contextName());
                return n;
            case LITERAL:
                return literal(n);
            case ATTRIBUTE:
            case SUBSCRIPT:
            case GROUP:
            case ARG:
                return n.withChildren(expressions(n.children()));
            case CALL:
                return call(n);
            default:
                return n;
        }
    }

    /** One operand of a sequence: a removed call chain collapses to its placeholder. */
    private Node piece(Node piece) {
        Node root = Nodes.rootCall(piece);
        if (root != null) {
            CallRule rule = table.rule(Nodes.dottedName(root.child(0)));
            if (rule != null && rule.isRemoved()) {
                if (rule.schedule) recordSchedule(rule, root, true);
                String original = ScriptPrinter.expression(piece);
                diagnostics.warning(line, rule.source + " has no PTrade equivalent; replaced by placeholder "
                        + rule.placeholder + " (was: " + original + ")");
                return Node.literal(rule.placeholder, piece.spaceBefore());
            }
        }
        return expression(piece);
    }

    private Node call(Node n) {
        String callee = Nodes.dottedName(n.child(0));
        List<Node> children = new ArrayList<>(n.children().size());
        // 被调用者是点分名时不改写（g.func() 的 g 仍要替换）
        children.add(callee != null && table.rule(callee) != null ? n.child(0) : expression(n.child(0)));
        for (Node a : n.args()) children.add(expression(a));
        Node rebuilt = n.withChildren(children);

        CallRule rule = table.rule(callee);
        if (rule == null || rule.isRemoved()) return rebuilt;
        if (rule.schedule) recordSchedule(rule, n, false);
        Node out = rebuilt;
        for (ArgFix fix : rule.fixes) out = fix.apply(out);
        if (!rule.target.equals(callee)) {
            List<Node> withTarget = new ArrayList<>(out.children());
            withTarget.set(0, Nodes.dotted(rule.target, out.child(0).spaceBefore()));
            out = out.withChildren(withTarget);
        }
        if (rule.warning != null) diagnostics.warning(line, rule.warning);
        return out.withSpaceBefore(n.spaceBefore());
    }

    private void recordSchedule(CallRule rule, Node call, boolean removed) {
        List<Node> positional = Nodes.positional(call);
        String callback = null;
        for (Node p : positional) {
            // run_daily(context, func) 形式：跳过已经插入的 context
            String name = Nodes.argName(p);
            if (name != null && !name.equals(table.contextName())) {
                callback = name;
                break;
            }
            if (name == null) break;
        }
        schedules.add(new ScheduleRegistration(rule.source, callback, line, removed));
    }

    private Node literal(Node n) {
        String text = n.text();
        int quote = firstQuote(text);
        if (quote < 0) return n;
        String out = text;
        for (Map.Entry<String, String> e : table.literalRewrites().entrySet()) {
            out = out.replace(e.getKey(), e.getValue());
        }
        if (quote > 0 && text.substring(0, quote).toLowerCase(Locale.ROOT).contains("f")) {
            out = rewriteFormatFields(out);
        }
        return out.equals(text) ? n : n.withText(out);
    }

    private static int firstQuote(String s) {
        int a = s.indexOf('\'');
        int b = s.indexOf('"');
        if (a < 0) return b;
        if (b < 0) return a;
        return Math.min(a, b);
    }

    /** f"{g.count}" -> f"{context.count}" */
    private String rewriteFormatFields(String literal) {
        if (globalBound) return literal;
        Matcher m = FSTRING_FIELD.matcher(literal);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String field = globalRef.matcher(m.group(1)).replaceAll(Matcher.quoteReplacement(table.contextName() + "."));
            m.appendReplacement(sb, Matcher.quoteReplacement("{" + field + "}"));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Dotted name of a removed call anywhere inside {@code n}, or null. */
    private String removedCallIn(Node n) {
        for (Node c : Nodes.findAll(n, Node.Kind.CALL)) {
            CallRule rule = table.rule(Nodes.dottedName(c.child(0)));
            if (rule != null && rule.isRemoved()) return rule.source;
        }
        return null;
    }
}
