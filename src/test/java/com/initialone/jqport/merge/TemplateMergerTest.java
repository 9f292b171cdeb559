package com.initialone.jqport.merge;

import com.initialone.jqport.TestScripts;
import com.initialone.jqport.ast.CallSiteRewriter;
import com.initialone.jqport.ast.ContextThreader;
import com.initialone.jqport.ast.ScriptParser;
import com.initialone.jqport.ast.SyntaxTree;
import com.initialone.jqport.model.Diagnostic;
import com.initialone.jqport.model.Diagnostics;
import com.initialone.jqport.model.Severity;
import com.initialone.jqport.symbols.StructuralTemplate;
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

class TemplateMergerTest {

    private static SymbolTable generic;
    private static SymbolTable live;
    private static SymbolTable simulation;
    private static SymbolTable realtime;

    private Diagnostics diagnostics;

    @BeforeAll
    static void loadTables() throws Exception {
        VariantResolver resolver = new VariantResolver();
        generic = resolver.resolve(Variant.GENERIC);
        live = resolver.resolve(Variant.LIVE);
        simulation = resolver.resolve(Variant.SIMULATION);
        realtime = resolver.resolve(Variant.REALTIME_DATA_ONLY);
    }

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
    }

    private String merge(String src, SymbolTable table) throws Exception {
        CallSiteRewriter.RewriteResult rewritten = CallSiteRewriter.rewrite(ScriptParser.parse(src), table, diagnostics);
        SyntaxTree threaded = ContextThreader.thread(rewritten.tree(), table, diagnostics);
        ExtractedScript script = FunctionExtractor.extract(threaded);
        PromotionPlan plan = PromotionPlan.plan(script, rewritten.schedules(), table, diagnostics);
        return TemplateMerger.merge(table.template(), script, plan, diagnostics);
    }

    private List<Diagnostic> diags() {
        return diagnostics.snapshot();
    }

    @Nested
    @DisplayName("Slots")
    class Slots {

        @Test
        @DisplayName("unfilled lifecycle slots come from the template, helpers follow")
        void synthesized() throws Exception {
            String out = merge("def helper(x):\n    return x\n", generic);

            int previous = -1;
            for (String name : StructuralTemplate.LIFECYCLE) {
                assertThat(TestScripts.countTopLevelDefs(out, name)).as(name).isEqualTo(1);
                int at = out.indexOf("def " + name + "(");
                assertThat(at).isGreaterThan(previous);
                previous = at;
            }
            assertThat(out.indexOf("def helper(x):")).isGreaterThan(previous);
            assertThat(diags()).isEmpty();
        }

        @Test
        @DisplayName("template preamble first, then the source preamble")
        void preambleOrder() throws Exception {
            String out = merge("import numpy as np\nN = 3\n\ndef initialize(context):\n    pass\n", generic);

            assertThat(out).startsWith("# -*- coding: utf-8 -*-");
            assertThat(out.indexOf("import numpy as np")).isLessThan(out.indexOf("def initialize"));
            assertThat(out.indexOf("N = 3")).isLessThan(out.indexOf("def initialize"));
        }

        @Test
        @DisplayName("lifecycle function with a different signature is re-signed")
        void resigned() throws Exception {
            String out = merge("def before_trading_start(ctx):\n    log.info(ctx.portfolio)\n", generic);

            assertThat(out).contains("def before_trading_start(context, data):\n    log.info(context.portfolio)");
            assertThat(diags()).singleElement()
                    .satisfies(d -> assertThat(d.message).contains("re-signed").contains("ctx -> context"));
        }

        @Test
        @DisplayName("a repeated definition is dropped with a warning")
        void duplicateDefinition() throws Exception {
            String out = merge("def handle_data(context, data):\n    a = 1\n\ndef handle_data(context, data):\n    b = 2\n",
                    generic);

            assertThat(out).contains("b = 2").doesNotContain("a = 1");
            assertThat(TestScripts.countTopLevelDefs(out, "handle_data")).isEqualTo(1);
            assertThat(diags()).singleElement().satisfies(d -> {
                assertThat(d.severity).isEqualTo(Severity.WARNING);
                assertThat(d.line).isEqualTo(1);
            });
        }

        @Test
        @DisplayName("template helper is emitted only when called")
        void helperOnlyWhenReferenced() throws Exception {
            String used = merge("def handle_data(context, data):\n    cur = get_current_data()\n", simulation);
            assertThat(used).contains("cur = get_current_data_lookback(context)")
                    .contains("def get_current_data_lookback(context, security_list=None):");

            String unused = merge("def handle_data(context, data):\n    order('600000.XSHG', 100)\n", simulation);
            assertThat(unused).doesNotContain("get_current_data_lookback");
        }
    }

    @Nested
    @DisplayName("Promotion")
    class Promotion {

        @Test
        @DisplayName("before_market_open takes the pre-session slot and loses its registration")
        void namingPattern() throws Exception {
            String out = merge("def initialize(context):\n    run_daily(before_market_open, time='before_open')\n\n"
                    + "def before_market_open(context):\n    log.info('pre')\n", generic);

            assertThat(out).contains("def before_trading_start(context, data):\n    log.info('pre')")
                    .contains("def initialize(context):\n    pass\n")
                    .doesNotContain("before_market_open")
                    .doesNotContain("run_daily");
            assertThat(diags()).hasSize(3).allSatisfy(d -> assertThat(d.severity).isEqualTo(Severity.INFO));
        }

        @Test
        @DisplayName("callback of a removed weekly schedule becomes handle_data")
        void periodicSlot() throws Exception {
            String out = merge("def initialize(context):\n    run_weekly(rebalance, 1, time='open')\n\n"
                    + "def rebalance(context):\n    order('600000.XSHG', 100)\n", live);

            assertThat(out).contains("def handle_data(context, data):\n    order('600000.SS', 100)")
                    .contains("# [REVIEW] removed run_weekly:");
            assertThat(TestScripts.countTopLevelDefs(out, "rebalance")).isZero();
            assertThat(TestScripts.countTopLevelDefs(out, "handle_data")).isEqualTo(1);
            assertThat(diags()).extracting(d -> d.severity)
                    .containsExactly(Severity.WARNING, Severity.INFO, Severity.INFO);
        }

        @Test
        @DisplayName("competing candidates: the first wins, the rest are reported")
        void competingCandidates() throws Exception {
            String out = merge("def initialize(context):\n"
                    + "    run_weekly(a_task, 1, time='open')\n"
                    + "    run_monthly(b_task, 1, time='open')\n\n"
                    + "def a_task(context):\n    pass\n\n"
                    + "def b_task(context):\n    pass\n", live);

            assertThat(out).contains("def b_task(context):");
            assertThat(TestScripts.countTopLevelDefs(out, "a_task")).isZero();
            assertThat(diags()).filteredOn(d -> d.severity == Severity.WARNING)
                    .anySatisfy(d -> assertThat(d.message).contains("b_task").contains("a_task was promoted"));
        }

        @Test
        @DisplayName("no promotion when the periodic slot is already defined")
        void slotTaken() throws Exception {
            String out = merge("def initialize(context):\n    run_weekly(rebalance, 1, time='open')\n\n"
                    + "def handle_data(context, data):\n    pass\n\n"
                    + "def rebalance(context):\n    pass\n", live);

            assertThat(out).contains("def rebalance(context):");
            assertThat(diags()).filteredOn(d -> d.severity == Severity.WARNING)
                    .anySatisfy(d -> assertThat(d.message).contains("handle_data is already defined"));
        }

        @Test
        @DisplayName("a periodic-looking name that is still referenced stays a helper")
        void stillReferenced() throws Exception {
            String out = merge("def initialize(context):\n    context.tasks = [weekly_adjustment]\n\n"
                    + "def weekly_adjustment(context):\n    pass\n", realtime);

            assertThat(out).contains("def weekly_adjustment(context):")
                    .contains("context.tasks = [weekly_adjustment]")
                    .contains("def handle_data(context, data):\n    pass\n");
        }

        @Test
        @DisplayName("realtime-data-only removes a weekly schedule and promotes its callback")
        void realtimeWeekly() throws Exception {
            String out = merge("def initialize(context):\n    run_weekly(weekly_adjustment, 1, time='open')\n\n"
                    + "def weekly_adjustment(context):\n    order('600000.XSHG', 100)\n", realtime);

            assertThat(out).contains("# [REVIEW] removed run_weekly:")
                    .contains("def handle_data(context, data):\n    order('600000.SS', 100)");
            assertThat(TestScripts.countTopLevelDefs(out, "weekly_adjustment")).isZero();
            assertThat(diags()).first().satisfies(d -> {
                assertThat(d.severity).isEqualTo(Severity.WARNING);
                assertThat(d.line).isEqualTo(2);
                assertThat(d.message).contains("run_weekly");
            });
        }
    }

    @Nested
    @DisplayName("Missing imports")
    class Imports {

        @Test
        @DisplayName("a pd placeholder in a script without imports adds import pandas as pd")
        void pandasAdded() throws Exception {
            String out = merge("def handle_data(context, data):\n    q = query(valuation.code)\n"
                    + "    df = get_fundamentals(q)\n", generic);

            assertThat(out).contains("df = pd.DataFrame()").contains("\nimport pandas as pd\n");
            assertThat(out.indexOf("import pandas as pd")).isLessThan(out.indexOf("def initialize"));
            assertThat(diags()).filteredOn(d -> d.severity == Severity.INFO)
                    .anySatisfy(d -> {
                        assertThat(d.line).isEqualTo(3);
                        assertThat(d.message).isEqualTo("added missing import: import pandas as pd");
                    });
        }

        @Test
        @DisplayName("an existing alias import is not repeated")
        void existingImport() throws Exception {
            String out = merge("import pandas as pd\n\ndef handle_data(context, data):\n"
                    + "    df = get_fundamentals(query(valuation.code))\n", generic);

            assertThat(out.split("import pandas as pd", -1)).hasSize(2);
            assertThat(diags()).noneSatisfy(d -> assertThat(d.message).startsWith("added missing import"));
        }

        @Test
        @DisplayName("aliases inside strings and comments do not count as uses")
        void quotedUse() throws Exception {
            String out = merge("def handle_data(context, data):\n    # np.mean is not used here\n"
                    + "    log.info('np.mean')\n", generic);

            assertThat(out).doesNotContain("import numpy");
            assertThat(diags()).isEmpty();
        }

        @Test
        @DisplayName("from-imports and dotted imports bind their names")
        void boundNames() {
            assertThat(MissingImports.boundNames("import datetime.date as d, numpy.linalg"))
                    .containsExactly("d", "numpy");
            assertThat(MissingImports.boundNames("from datetime import (datetime, timedelta as td)"))
                    .containsExactly("datetime", "td");
        }
    }
}
