package com.initialone.jqport.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jqport.Main;
import com.initialone.jqport.model.ConfigException;
import com.initialone.jqport.symbols.CallRule;
import com.initialone.jqport.symbols.SymbolTable;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 打印某个变体的生效调用表（内置规则 + 覆盖表），方便核对映射。
 */
@CommandLine.Command(
        name = "table",
        description = "Print the effective call table of a variant as JSON"
)
public class TableCmd implements Callable<Integer> {

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write JSON here instead of stdout")
    Path output;

    @CommandLine.Mixin
    VariantOptions variantOptions;

    /** JSON 结构：顶层就是 public 字段的 POJO */
    public static class TableDoc {
        public String variant;
        public String template;
        public boolean collapseSchedules;
        public String periodicSlot;
        public Map<String, String> mapped;
        public Map<String, String> removed = new LinkedHashMap<>();
        public List<String> removedImports;
        public List<CallRule> rules;
    }

    @Override
    public Integer call() {
        try {
            SymbolTable table = variantOptions.resolve();
            String json = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(describe(table));
            if (output == null) {
                System.out.println(json);
            } else {
                ConvertCmd.writeAtomically(output, json);
                System.out.println("[table] " + table.variant() + ": " + table.rules().size() + " rules -> " + output);
            }
            return 0;
        } catch (ConfigException e) {
            System.err.println("[table] config error: " + e.getMessage());
            return Main.EXIT_CONFIG;
        } catch (IOException e) {
            System.err.println("[table] io error: " + e);
            return Main.EXIT_CONFIG;
        }
    }

    static TableDoc describe(SymbolTable table) {
        TableDoc doc = new TableDoc();
        doc.variant = table.variant().id();
        doc.template = table.template().name();
        doc.collapseSchedules = table.collapseSchedules();
        doc.periodicSlot = table.periodicSlot();
        doc.mapped = table.mapped();
        for (CallRule r : table.rules().values()) {
            if (r.isRemoved()) doc.removed.put(r.source, r.placeholder);
        }
        doc.removedImports = new ArrayList<>(table.removedImports());
        doc.rules = new ArrayList<>(table.rules().values());
        return doc;
    }
}
