package com.initialone.jqport.commands;

import com.initialone.jqport.Main;
import com.initialone.jqport.ScriptConverter;
import com.initialone.jqport.model.ConfigException;
import com.initialone.jqport.model.ConversionResult;
import com.initialone.jqport.model.ScriptParseException;
import com.initialone.jqport.symbols.SymbolTable;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 批量转换一个目录下的策略脚本。
 * - 变体与覆盖表只解析一次，所有文件共享同一张 SymbolTable
 * - 单个文件解析失败只记录并跳过，不中断整批
 * - 支持分批 / 并发 / 断点续跑（resume file 记录已完成的相对路径）
 */
@CommandLine.Command(
        name = "batch",
        description = "Convert every strategy script under a directory (tree layout is kept)"
)
public class BatchCmd implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", description = "Source directory of JoinQuant scripts")
    Path sourcesDir;

    @CommandLine.Parameters(index = "1", description = "Output directory for PTrade scripts")
    Path outDir;

    @CommandLine.Option(names = "--batch", defaultValue = "100",
            description = "Files per batch (default: ${DEFAULT-VALUE})")
    int batchSize;

    @CommandLine.Option(names = "--max-concurrent", defaultValue = "8",
            description = "Concurrent conversions (default: ${DEFAULT-VALUE})")
    int maxConcurrent;

    @CommandLine.Option(names = "--dry-run", description = "Only convert and report; write nothing")
    boolean dryRun;

    @CommandLine.Option(names = "--resume-file",
            description = "Record finished files here and skip them on the next run")
    Path resumeFile;

    @CommandLine.Option(names = "--extensions", split = ",", defaultValue = ".py",
            description = "Comma separated file extensions to convert (default: ${DEFAULT-VALUE})")
    List<String> extensions;

    @CommandLine.Option(names = "--report-dir",
            description = "Write one <script>.diagnostics.json per converted file into this directory")
    Path reportDir;

    @CommandLine.Mixin
    VariantOptions variantOptions;

    private final ScriptConverter converter = new ScriptConverter();

    @Override
    public Integer call() {
        SymbolTable table;
        List<Path> files;
        try {
            table = variantOptions.resolve();
            if (!Files.isDirectory(sourcesDir)) {
                System.err.println("[batch] not a directory: " + sourcesDir);
                return Main.EXIT_CONFIG;
            }
            files = listFiles(sourcesDir, extensions);
        } catch (ConfigException e) {
            System.err.println("[batch] config error: " + e.getMessage());
            return Main.EXIT_CONFIG;
        } catch (IOException e) {
            System.err.println("[batch] io error: " + e);
            return Main.EXIT_CONFIG;
        }

        Set<String> done = loadDone(resumeFile);
        List<Path> todo = files.stream()
                .filter(p -> !done.contains(relative(p)))
                .collect(Collectors.toList());
        System.out.printf("[batch] variant=%s files=%d, skipped(resume)=%d, todo=%d, batch=%d, maxConcurrent=%d%s%n",
                table.variant(), files.size(), files.size() - todo.size(), todo.size(),
                batchSize, maxConcurrent, dryRun ? " (dry-run)" : "");

        BatchStat total = new BatchStat();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, maxConcurrent));
        try {
            List<List<Path>> batches = chunk(todo, Math.max(1, batchSize));
            for (int i = 0; i < batches.size(); i++) {
                BatchStat stat = processBatch(pool, batches.get(i), table);
                total.add(stat);
                System.out.printf("[batch] batch %d/%d: converted=%d, warned=%d, failed=%d%n",
                        i + 1, batches.size(), stat.converted.get(), stat.warned.get(), stat.failed.get());
            }
        } finally {
            pool.shutdownNow();
        }

        System.out.printf("[batch] done. converted=%d, with-review-notes=%d, failed=%d -> %s%n",
                total.converted.get(), total.warned.get(), total.failed.get(), outDir);
        return total.failed.get() == 0 ? 0 : Main.EXIT_PARSE;
    }

    private BatchStat processBatch(ExecutorService pool, List<Path> batch, SymbolTable table) {
        BatchStat stat = new BatchStat();
        List<Future<?>> futures = new ArrayList<>(batch.size());
        for (Path file : batch) {
            futures.add(pool.submit(() -> convertOne(file, table, stat)));
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                System.err.println("[batch] interrupted");
                break;
            } catch (Exception e) {
                stat.failed.incrementAndGet();
                System.err.println("[batch] task failed: " + e.getCause());
            }
        }
        return stat;
    }

    private void convertOne(Path file, SymbolTable table, BatchStat stat) {
        String rel = relative(file);
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            ConversionResult result = converter.convert(source, table);
            if (!dryRun) {
                ConvertCmd.writeAtomically(outDir.resolve(rel), result.outputText());
                if (reportDir != null) {
                    ConvertCmd.writeReport(reportDir.resolve(rel + ".diagnostics.json"), rel, result.diagnostics());
                }
                appendDone(resumeFile, rel);
            }
            stat.converted.incrementAndGet();
            if (result.hasWarnings()) stat.warned.incrementAndGet();
            System.out.printf("[batch] %s (%d notes)%n", rel, result.diagnostics().size());
        } catch (ScriptParseException e) {
            stat.failed.incrementAndGet();
            System.err.println("[batch] parse error, skipped " + rel + ": " + e.getMessage());
        } catch (IOException e) {
            stat.failed.incrementAndGet();
            System.err.println("[batch] io error, skipped " + rel + ": " + e);
        }
    }

    private String relative(Path file) {
        return sourcesDir.relativize(file).toString().replace('\\', '/');
    }

    /* ======================= 工具方法 ======================= */

    static List<Path> listFiles(Path root, List<String> exts) throws IOException {
        Set<String> wanted = exts.stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .map(s -> s.startsWith(".") ? s : "." + s)
                .collect(Collectors.toSet());
        try (Stream<Path> s = Files.walk(root)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> wanted.stream().anyMatch(
                            e -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(e)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static <T> List<List<T>> chunk(List<T> list, int size) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            out.add(list.subList(i, Math.min(list.size(), i + size)));
        }
        return out;
    }

    static Set<String> loadDone(Path resume) {
        if (resume == null || !Files.exists(resume)) return new HashSet<>();
        try {
            return Files.readAllLines(resume, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(HashSet::new));
        } catch (IOException e) {
            System.err.println("[batch] cannot read resume file " + resume + ": " + e);
            return new HashSet<>();
        }
    }

    static synchronized void appendDone(Path resume, String rel) throws IOException {
        if (resume == null) return;
        Path parent = resume.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(resume, rel + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    static final class BatchStat {
        final AtomicInteger converted = new AtomicInteger();
        final AtomicInteger warned = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();

        void add(BatchStat other) {
            converted.addAndGet(other.converted.get());
            warned.addAndGet(other.warned.get());
            failed.addAndGet(other.failed.get());
        }
    }
}
