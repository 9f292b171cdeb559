package com.initialone.jqport;

import com.initialone.jqport.ast.CallSiteRewriter;
import com.initialone.jqport.ast.ContextThreader;
import com.initialone.jqport.ast.ScriptParser;
import com.initialone.jqport.ast.SyntaxTree;
import com.initialone.jqport.fix.TextFixer;
import com.initialone.jqport.merge.ExtractedScript;
import com.initialone.jqport.merge.FunctionExtractor;
import com.initialone.jqport.merge.PromotionPlan;
import com.initialone.jqport.merge.TemplateMerger;
import com.initialone.jqport.model.ConfigException;
import com.initialone.jqport.model.ConversionResult;
import com.initialone.jqport.model.Diagnostics;
import com.initialone.jqport.model.ScriptParseException;
import com.initialone.jqport.symbols.SymbolTable;
import com.initialone.jqport.symbols.Variant;
import com.initialone.jqport.symbols.VariantResolver;

import java.nio.file.Path;

/**
 * Converts one JoinQuant strategy script into a PTrade script:
 * parse, rewrite call sites, thread the context parameter, merge into the variant's template, then
 * run the text fixer. Performs no I/O apart from reading the optional override file, holds no
 * state between calls, and can be used from several threads at once.
 */
public class ScriptConverter {

    private final VariantResolver resolver;

    public ScriptConverter() {
        this(new VariantResolver());
    }

    public ScriptConverter(VariantResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param mappingOverride flat JSON override file, or null for the built-in table only
     * @throws ConfigException      unknown variant or malformed override, reported before parsing
     * @throws ScriptParseException source outside the supported syntax
     */
    public ConversionResult convert(String sourceText, Variant variant, Path mappingOverride)
            throws ConfigException, ScriptParseException {
        SymbolTable table = resolver.resolve(variant, mappingOverride);
        return convert(sourceText, table);
    }

    public ConversionResult convert(String sourceText, Variant variant) throws ConfigException, ScriptParseException {
        return convert(sourceText, variant, null);
    }

    /** Converts with an already resolved table; used by batch runs that share one table. */
    public ConversionResult convert(String sourceText, SymbolTable table) throws ScriptParseException {
        SyntaxTree tree = ScriptParser.parse(sourceText);
        Diagnostics diagnostics = new Diagnostics();

        CallSiteRewriter.RewriteResult rewritten = CallSiteRewriter.rewrite(tree, table, diagnostics);
        SyntaxTree threaded = ContextThreader.thread(rewritten.tree(), table, diagnostics);

        ExtractedScript script = FunctionExtractor.extract(threaded);
        PromotionPlan plan = PromotionPlan.plan(script, rewritten.schedules(), table, diagnostics);
        String merged = TemplateMerger.merge(table.template(), script, plan, diagnostics);

        String output = TextFixer.forTable(table).fix(merged);
        return new ConversionResult(output, diagnostics.snapshot());
    }
}
