package com.initialone.jqport.commands;

import com.initialone.jqport.Main;
import com.initialone.jqport.TestScripts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchCmdTest {

    @TempDir
    Path tmp;

    private Path src;
    private Path out;

    private static int run(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @BeforeEach
    void layout() throws Exception {
        src = tmp.resolve("src");
        out = tmp.resolve("out");
        Files.createDirectories(src.resolve("nested"));
        Files.writeString(src.resolve("rotation.py"), TestScripts.load("small_cap_rotation.py"));
        Files.writeString(src.resolve("nested/helper.py"), TestScripts.load("helper_only.py"));
        Files.writeString(src.resolve("notes.txt"), "not a script");
    }

    @Nested
    @DisplayName("Conversion")
    class Conversion {

        @Test
        @DisplayName("converts every script and keeps the tree layout")
        void convertsTree() throws Exception {
            Path reports = tmp.resolve("reports");

            int code = run("batch", src.toString(), out.toString(), "--report-dir", reports.toString(),
                    "--max-concurrent", "2", "--batch", "1");

            assertThat(code).isZero();
            assertThat(Files.readString(out.resolve("rotation.py"))).contains("def initialize(context):");
            assertThat(Files.readString(out.resolve("nested/helper.py"))).contains("def rebalance(context):");
            assertThat(out.resolve("notes.txt")).doesNotExist();
            assertThat(reports.resolve("nested/helper.py.diagnostics.json")).exists();
        }

        @Test
        @DisplayName("a broken script is skipped, the others are still written, exit code 1")
        void brokenScript() throws Exception {
            Files.writeString(src.resolve("broken.py"), TestScripts.load("broken_indent.py"));

            int code = run("batch", src.toString(), out.toString());

            assertThat(code).isEqualTo(Main.EXIT_PARSE);
            assertThat(out.resolve("broken.py")).doesNotExist();
            assertThat(out.resolve("rotation.py")).exists();
            assertThat(out.resolve("nested/helper.py")).exists();
        }

        @Test
        @DisplayName("dry run writes nothing")
        void dryRun() throws Exception {
            Path resume = tmp.resolve("done.txt");

            int code = run("batch", src.toString(), out.toString(), "--dry-run", "--resume-file", resume.toString());

            assertThat(code).isZero();
            assertThat(out).doesNotExist();
            assertThat(resume).doesNotExist();
        }

        @Test
        @DisplayName("missing source directory exits 2")
        void missingSource() {
            assertThat(run("batch", tmp.resolve("absent").toString(), out.toString())).isEqualTo(Main.EXIT_CONFIG);
        }
    }

    @Nested
    @DisplayName("Resume")
    class Resume {

        @Test
        @DisplayName("finished files are recorded and skipped on the next run")
        void skipsFinished() throws Exception {
            Path resume = tmp.resolve("done.txt");

            assertThat(run("batch", src.toString(), out.toString(), "--resume-file", resume.toString())).isZero();
            assertThat(Files.readAllLines(resume)).containsExactlyInAnyOrder("rotation.py", "nested/helper.py");

            Files.delete(out.resolve("rotation.py"));
            assertThat(run("batch", src.toString(), out.toString(), "--resume-file", resume.toString())).isZero();

            assertThat(out.resolve("rotation.py")).doesNotExist();
        }
    }

    @Nested
    @DisplayName("Helpers")
    class Helpers {

        @Test
        @DisplayName("extensions filter, with or without the dot")
        void listFiles() throws Exception {
            assertThat(BatchCmd.listFiles(src, List.of("txt"))).containsExactly(src.resolve("notes.txt"));
            assertThat(BatchCmd.listFiles(src, List.of(".PY"))).hasSize(2);
        }

        @Test
        @DisplayName("chunking keeps order and the remainder")
        void chunk() {
            assertThat(BatchCmd.chunk(List.of(1, 2, 3, 4, 5), 2))
                    .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
        }
    }
}
