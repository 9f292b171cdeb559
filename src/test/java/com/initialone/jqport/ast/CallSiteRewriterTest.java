package com.initialone.jqport.ast;

import com.initialone.jqport.model.Diagnostic;
import com.initialone.jqport.model.Diagnostics;
import com.initialone.jqport.model.Severity;
import com.initialone.jqport.symbols.SymbolTable;
import com.initialone.jqport.symbols.Variant;
import com.initialone.jqport.symbols.VariantResolver;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CallSiteRewriterTest {

    private static SymbolTable generic;

    private Diagnostics diagnostics;

    @BeforeAll
    static void loadTable() throws Exception {
        generic = new VariantResolver().resolve(Variant.GENERIC);
    }

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
    }

    private CallSiteRewriter.RewriteResult run(String src) throws Exception {
        return CallSiteRewriter.rewrite(ScriptParser.parse(src), generic, diagnostics);
    }

    private String rewrite(String src) throws Exception {
        return ScriptPrinter.print(run(src).tree());
    }

    private List<Diagnostic> diags() {
        return diagnostics.snapshot();
    }

    @Nested
    @DisplayName("Mapped calls")
    class Mapped {

        @Test
        @DisplayName("1:1 mapping renames the callee and keeps the arguments")
        void oneToOne() throws Exception {
            String out = rewrite("def f(context):\n    info = get_security_info('000001.XSHE')\n");

            assertThat(out).contains("info = get_stock_info('000001.SZ')");
            assertThat(diags()).isEmpty();
        }

        @Test
        @DisplayName("history call gets its arguments reshaped")
        void historyReshaped() throws Exception {
            String out = rewrite("h = attribute_history(s, 5, unit='1d', fields=['close'], skip_paused=True)\n");

            assertThat(out).isEqualTo("h = get_history(5, frequency='1d', field=['close'], security_list=s)\n");
        }

        @Test
        @DisplayName("run_daily gets context and a clock time; the registration is recorded")
        void runDaily() throws Exception {
            CallSiteRewriter.RewriteResult result = run(
                    "def initialize(context):\n    run_daily(market_open, time='open', reference_security='000300.XSHG')\n");

            assertThat(ScriptPrinter.print(result.tree())).contains("run_daily(context, market_open, time='9:30')");
            assertThat(result.schedules()).hasSize(1);
            assertThat(result.schedules().get(0).callback).isEqualTo("market_open");
            assertThat(result.schedules().get(0).removed).isFalse();
        }

        @Test
        @DisplayName("a rule with a warning records it")
        void mappedWithWarning() throws Exception {
            String out = rewrite("def initialize(context):\n    set_slippage(FixedSlippage(0.02))\n");

            assertThat(out).contains("set_fixed_slippage(FixedSlippage(0.02))");
            assertThat(diags()).extracting(d -> d.severity).containsExactly(Severity.WARNING);
        }

        @Test
        @DisplayName("get_all_securities drops the type filter, positional or keyword")
        void allSecurities() throws Exception {
            assertThat(rewrite("stocks = list(get_all_securities(['stock']).index)\n"))
                    .isEqualTo("stocks = list(get_Ashares().index)\n");
            assertThat(rewrite("stocks = get_all_securities('stock', '2020-01-01')\n"))
                    .isEqualTo("stocks = get_Ashares('2020-01-01')\n");
            assertThat(rewrite("stocks = get_all_securities(types=['stock'], date='2020-01-01')\n"))
                    .isEqualTo("stocks = get_Ashares(date='2020-01-01')\n");
            assertThat(diags()).isEmpty();
        }

        @Test
        @DisplayName("calls without a rule are untouched")
        void unknownCall() throws Exception {
            assertThat(rewrite("order_target(s, 0)\n")).isEqualTo("order_target(s, 0)\n");
        }
    }

    @Nested
    @DisplayName("Removed calls")
    class Removed {

        @Test
        @DisplayName("value use is replaced by the placeholder with one warning")
        void placeholder() throws Exception {
            String out = rewrite("def handle_data(context, data):\n    x = 1\n    ticks = get_ticks(s, count=10)\n");

            assertThat(out).contains("ticks = None");
            assertThat(diags()).hasSize(1);
            assertThat(diags().get(0).severity).isEqualTo(Severity.WARNING);
            assertThat(diags().get(0).line).isEqualTo(3);
            assertThat(diags().get(0).message).contains("get_ticks");
        }

        @Test
        @DisplayName("method chain collapses to the placeholder")
        void chain() throws Exception {
            String out = rewrite("q = query(valuation.code).filter(valuation.pe_ratio < 10).limit(5)\n");

            assertThat(out).isEqualTo("q = None\n");
        }

        @Test
        @DisplayName("statement use becomes a review comment")
        void statement() throws Exception {
            String out = rewrite("def f(context):\n    send_message('hi')\n");

            assertThat(out).contains("    # [REVIEW] removed send_message: send_message('hi')");
            assertThat(diags()).extracting(d -> d.severity).containsExactly(Severity.INFO);
        }

        @Test
        @DisplayName("removed call in an assignment target blocks the line")
        void assignmentTarget() throws Exception {
            String out = rewrite("def f(context):\n    get_extras('is_st', s)['x'] = 1\n");

            assertThat(out).contains("# [REVIEW] blocked get_extras:");
            assertThat(diags()).extracting(d -> d.severity).containsExactly(Severity.BLOCKED);
        }
    }

    @Nested
    @DisplayName("Global object")
    class GlobalObject {

        @Test
        @DisplayName("g is retargeted onto context inside functions")
        void retargeted() throws Exception {
            String out = rewrite("def f(context):\n    g.stocks = ['600000.XSHG']\n    log.info(g.stocks)\n");

            assertThat(out).contains("context.stocks = ['600000.SS']").contains("log.info(context.stocks)");
            assertThat(diags()).isEmpty();
        }

        @Test
        @DisplayName("a parameter named g shadows the global object")
        void shadowedByParameter() throws Exception {
            assertThat(rewrite("def f(g):\n    return g.x\n")).contains("return g.x");
        }

        @Test
        @DisplayName("module-level use is rewritten with a warning")
        void moduleLevel() throws Exception {
            String out = rewrite("g.count = 0\n");

            assertThat(out).isEqualTo("context.count = 0\n");
            assertThat(diags()).extracting(d -> d.severity).containsExactly(Severity.WARNING);
        }

        @Test
        @DisplayName("module-level if blocks count as module level")
        void moduleLevelBlock() throws Exception {
            String out = rewrite("if True:\n    g.count = 0\n");

            assertThat(out).isEqualTo("if True:\n    context.count = 0\n");
            assertThat(diags()).singleElement().satisfies(d -> {
                assertThat(d.severity).isEqualTo(Severity.WARNING);
                assertThat(d.line).isEqualTo(2);
                assertThat(d.message).contains("module-level");
            });
        }

        @Test
        @DisplayName("use inside a class body is rewritten with a warning naming the class")
        void insideClass() throws Exception {
            String out = rewrite("class Helper:\n    def total(self):\n        return g.count\n");

            assertThat(out).contains("        return context.count\n");
            assertThat(diags()).singleElement().satisfies(d -> {
                assertThat(d.severity).isEqualTo(Severity.WARNING);
                assertThat(d.line).isEqualTo(3);
                assertThat(d.message).contains("inside class Helper");
            });
        }

        @Test
        @DisplayName("global declarations of g are dropped")
        void globalStatement() throws Exception {
            String out = rewrite("def f():\n    global g, counter\n    g.x = 1\n\ndef h():\n    global g\n    g.y = 2\n");

            assertThat(out).contains("    global counter\n").doesNotContain("global g");
        }

        @Test
        @DisplayName("f-string fields follow the retargeting")
        void formatString() throws Exception {
            assertThat(rewrite("def f(context):\n    log.info(f'{g.n} stocks')\n")).contains("f'{context.n} stocks'");
        }
    }

    @Nested
    @DisplayName("Definition headers")
    class Headers {

        @Test
        @DisplayName("a removed call in a parameter default becomes its placeholder")
        void parameterDefault() throws Exception {
            String out = rewrite("def f(context, n=get_ticks('000001.XSHE')):\n    return n\n");

            assertThat(out).startsWith("def f(context, n=None):\n");
            assertThat(diags()).singleElement().satisfies(d -> {
                assertThat(d.severity).isEqualTo(Severity.WARNING);
                assertThat(d.line).isEqualTo(1);
                assertThat(d.message).contains("get_ticks");
            });
        }

        @Test
        @DisplayName("g in a parameter default is retargeted before the parameters bind")
        void globalInDefault() throws Exception {
            assertThat(rewrite("def f(context, n=g.count):\n    return n\n"))
                    .startsWith("def f(context, n=context.count):\n");
            assertThat(diags()).singleElement().satisfies(d -> {
                assertThat(d.severity).isEqualTo(Severity.WARNING);
                assertThat(d.message).contains("module-level");
            });
        }

        @Test
        @DisplayName("class decorators and base lists are rewritten")
        void classHeader() throws Exception {
            String out = rewrite("@get_security_info('000001.XSHE')\nclass Holder(get_ticks('x')):\n    pass\n");

            assertThat(out).isEqualTo("@get_stock_info('000001.SZ')\nclass Holder(None):\n    pass\n");
            assertThat(diags()).extracting(d -> d.severity).containsExactly(Severity.WARNING);
        }
    }

    @Nested
    @DisplayName("Imports")
    class Imports {

        @Test
        @DisplayName("source-platform import becomes a review comment")
        void removedImport() throws Exception {
            String out = rewrite("from jqdata import *\nimport numpy as np\n");

            assertThat(out).isEqualTo("# [REVIEW] removed import: from jqdata import *\nimport numpy as np\n");
            assertThat(diags()).extracting(d -> d.severity).containsExactly(Severity.INFO);
        }

        @Test
        @DisplayName("mixed import line is disabled with a warning")
        void mixedImport() throws Exception {
            String out = rewrite("import jqdata, numpy\n");

            assertThat(out).startsWith("# [REVIEW] removed import:");
            assertThat(diags()).extracting(d -> d.severity).containsExactly(Severity.WARNING);
        }
    }

    @Test
    @DisplayName("input tree is not modified")
    void inputUnchanged() throws Exception {
        SyntaxTree tree = ScriptParser.parse("x = get_current_data()\n");
        String before = ScriptPrinter.print(tree);

        CallSiteRewriter.rewrite(tree, generic, diagnostics);

        assertThat(ScriptPrinter.print(tree)).isEqualTo(before);
    }
}
