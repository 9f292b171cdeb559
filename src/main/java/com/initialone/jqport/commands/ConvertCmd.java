package com.initialone.jqport.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jqport.Main;
import com.initialone.jqport.ScriptConverter;
import com.initialone.jqport.model.ConfigException;
import com.initialone.jqport.model.ConversionResult;
import com.initialone.jqport.model.Diagnostic;
import com.initialone.jqport.model.ScriptParseException;
import com.initialone.jqport.model.Severity;
import com.initialone.jqport.symbols.SymbolTable;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 转换单个聚宽策略脚本。
 * - 解析失败 / 配置错误时不写任何输出文件
 * - 未指定 -o 时脚本写到 stdout，进度与诊断写到 stderr
 */
@CommandLine.Command(
        name = "convert",
        description = "Convert one JoinQuant strategy script into a PTrade script"
)
public class ConvertCmd implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "JoinQuant strategy script (.py)")
    Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output script path (default: stdout)")
    Path output;

    @CommandLine.Option(names = "--report", description = "Write diagnostics as JSON to this file")
    Path report;

    @CommandLine.Mixin
    VariantOptions variantOptions;

    @Override
    public Integer call() {
        PrintStream log = output == null ? System.err : System.out;
        try {
            SymbolTable table = variantOptions.resolve();
            String source = Files.readString(input, StandardCharsets.UTF_8);
            ConversionResult result = new ScriptConverter().convert(source, table);

            if (output == null) {
                System.out.print(result.outputText());
            } else {
                writeAtomically(output, result.outputText());
            }
            if (report != null) writeReport(report, input.toString(), result.diagnostics());

            for (Diagnostic d : result.diagnostics()) log.println("[convert] " + d);
            log.printf("[convert] %s -> %s (variant=%s, info=%d, warning=%d, blocked=%d)%n",
                    input, output == null ? "stdout" : output, table.variant(),
                    count(result.diagnostics(), Severity.INFO),
                    count(result.diagnostics(), Severity.WARNING),
                    count(result.diagnostics(), Severity.BLOCKED));
            return 0;
        } catch (ScriptParseException e) {
            System.err.println("[convert] parse error in " + input + ": " + e.getMessage());
            return Main.EXIT_PARSE;
        } catch (ConfigException e) {
            System.err.println("[convert] config error: " + e.getMessage());
            return Main.EXIT_CONFIG;
        } catch (IOException e) {
            System.err.println("[convert] io error: " + e);
            return Main.EXIT_CONFIG;
        }
    }

    private static long count(List<Diagnostic> diagnostics, Severity severity) {
        return diagnostics.stream().filter(d -> d.severity == severity).count();
    }

    /* ======================= 输出工具（batch 共用） ======================= */

    /** Writes to a sibling temp file first so readers never see a half-written script. */
    static void writeAtomically(Path target, String text) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static void writeReport(Path target, String source, List<Diagnostic> diagnostics) throws IOException {
        ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("source", source);
        doc.put("diagnostics", diagnostics);
        writeAtomically(target, om.writeValueAsString(doc));
    }
}
