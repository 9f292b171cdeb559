package com.initialone.jqport.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jqport.Main;
import com.initialone.jqport.symbols.Variant;
import com.initialone.jqport.symbols.VariantResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TableCmdTest {

    @Test
    @DisplayName("dumps the resolved table as JSON")
    void dumps(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("table.json");

        int code = new CommandLine(new Main()).execute("table", "--variant", "live", "-o", out.toString());

        assertThat(code).isZero();
        JsonNode doc = new ObjectMapper().readTree(out.toFile());
        assertThat(doc.get("variant").asText()).isEqualTo("live");
        assertThat(doc.get("periodicSlot").asText()).isEqualTo("handle_data");
        assertThat(doc.get("mapped").get("get_current_data").asText()).isEqualTo("get_snapshot");
        assertThat(doc.get("mapped").has("set_order_cost")).isFalse();
        assertThat(doc.get("removed").has("set_order_cost")).isTrue();
        assertThat(doc.get("removed").has("run_weekly")).isTrue();
    }

    @Test
    @DisplayName("describe lists removed calls with their placeholders")
    void describe() throws Exception {
        TableCmd.TableDoc doc = TableCmd.describe(new VariantResolver().resolve(Variant.GENERIC));

        assertThat(doc.template).isEqualTo("ptrade");
        assertThat(doc.collapseSchedules).isTrue();
        assertThat(doc.removed).containsEntry("get_fundamentals", "pd.DataFrame()");
        assertThat(doc.removedImports).contains("jqdata");
    }

    @Test
    @DisplayName("unknown variant exits 2")
    void unknownVariant() {
        assertThat(new CommandLine(new Main()).execute("table", "--variant", "paper")).isEqualTo(Main.EXIT_CONFIG);
    }
}
