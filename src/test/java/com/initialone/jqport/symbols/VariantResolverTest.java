package com.initialone.jqport.symbols;

import com.initialone.jqport.model.ConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VariantResolverTest {

    private VariantResolver resolver;

    @TempDir
    Path tmp;

    @BeforeEach
    void setUp() {
        resolver = new VariantResolver();
    }

    private Path override(String json) throws Exception {
        Path file = tmp.resolve("mapping.json");
        Files.writeString(file, json);
        return file;
    }

    @Nested
    @DisplayName("Built-in tables")
    class BuiltIn {

        @Test
        @DisplayName("generic: mapping, removed set and template")
        void generic() throws Exception {
            SymbolTable table = resolver.resolve(Variant.GENERIC);

            assertThat(table.mapped()).containsEntry("get_current_data", "get_snapshot")
                    .containsEntry("run_weekly", "run_daily");
            assertThat(table.removed()).contains("set_option", "log.set_level", "get_fundamentals");
            assertThat(table.template().name()).isEqualTo("ptrade");
            assertThat(table.periodicSlot()).isNull();
            assertThat(table.collapseSchedules()).isTrue();
            assertThat(table.rule("get_fundamentals").placeholder).isEqualTo("pd.DataFrame()");
        }

        @Test
        @DisplayName("simulation inherits generic and swaps the snapshot for a lookback helper")
        void simulation() throws Exception {
            SymbolTable table = resolver.resolve(Variant.SIMULATION);

            assertThat(table.mapped()).containsEntry("get_current_data", "get_current_data_lookback")
                    .containsEntry("get_security_info", "get_stock_info");
            assertThat(table.removed()).contains("get_snapshot", "set_option");
            assertThat(table.template().helpers()).containsKey("get_current_data_lookback");
        }

        @Test
        @DisplayName("live keeps set_option, removes weekly / monthly schedules and set_order_cost, has a periodic slot")
        void live() throws Exception {
            SymbolTable table = resolver.resolve(Variant.LIVE);

            assertThat(table.rule("set_option")).isNull();
            assertThat(table.removed()).contains("run_weekly", "run_monthly");
            assertThat(table.mapped()).doesNotContainKey("set_order_cost");
            assertThat(table.rule("set_order_cost").isRemoved()).isTrue();
            assertThat(table.rule("set_order_cost").warning).contains("set_commission");
            assertThat(table.periodicSlot()).isEqualTo("handle_data");
            assertThat(table.collapseSchedules()).isFalse();
        }

        @Test
        @DisplayName("factor-only removes factor calls")
        void factorOnly() throws Exception {
            SymbolTable table = resolver.resolve(Variant.FACTOR_ONLY);

            assertThat(table.removed()).contains("get_factor_values", "get_all_factors");
            assertThat(table.rule("get_all_factors").placeholder).isEqualTo("[]");
        }

        @Test
        @DisplayName("realtime-data-only carries data calls only")
        void realtimeDataOnly() throws Exception {
            SymbolTable table = resolver.resolve(Variant.REALTIME_DATA_ONLY);

            assertThat(table.mapped()).containsOnlyKeys(
                    "get_current_data", "get_security_info", "attribute_history", "run_daily");
            assertThat(table.removed()).containsOnly("run_weekly", "run_monthly");
            assertThat(table.rule("run_weekly").schedule).isTrue();
            assertThat(table.periodicSlot()).isEqualTo("handle_data");
        }

        @Test
        @DisplayName("every variant's template has all lifecycle slots")
        void templates() throws Exception {
            for (Variant v : Variant.values()) {
                SymbolTable table = resolver.resolve(v);
                assertThat(table.template().slots()).containsOnlyKeys(StructuralTemplate.LIFECYCLE);
                assertThat(table.template().parameterNames("handle_data")).containsExactly("context", "data");
            }
        }
    }

    @Nested
    @DisplayName("Variant ids")
    class Ids {

        @Test
        @DisplayName("known ids resolve, case-insensitively")
        void known() throws Exception {
            assertThat(Variant.fromId("factor-only")).isEqualTo(Variant.FACTOR_ONLY);
            assertThat(Variant.fromId("LIVE")).isEqualTo(Variant.LIVE);
        }

        @Test
        @DisplayName("unknown id is a config error")
        void unknown() {
            assertThatThrownBy(() -> Variant.fromId("paper"))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("paper")
                    .hasMessageContaining("generic");
        }
    }

    @Nested
    @DisplayName("Mapping override")
    class Override {

        @Test
        @DisplayName("entries rename, remove or add calls; the rest falls back to the built-in table")
        void applied() throws Exception {
            Path file = override("{\"get_ticks\": \"get_tick_direction\", \"get_price\": null, \"my_call\": \"their_call\"}");

            SymbolTable table = resolver.resolve(Variant.GENERIC, file);

            assertThat(table.mapped()).containsEntry("get_ticks", "get_tick_direction")
                    .containsEntry("my_call", "their_call")
                    .containsEntry("get_current_data", "get_snapshot");
            assertThat(table.removed()).contains("get_price");
        }

        @Test
        @DisplayName("naming the built-in target keeps the built-in argument fixes")
        void sameTargetKeepsFixes() throws Exception {
            SymbolTable table = resolver.resolve(Variant.GENERIC, override("{\"attribute_history\": \"get_history\"}"));

            assertThat(table.rule("attribute_history").fixes).isNotEmpty();
        }

        @Test
        @DisplayName("malformed JSON")
        void malformed() throws Exception {
            Path file = override("{not json");

            assertThatThrownBy(() -> resolver.resolve(Variant.GENERIC, file))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("malformed");
        }

        @Test
        @DisplayName("not a flat object of names")
        void wrongShape() throws Exception {
            Path array = override("[1, 2]");
            assertThatThrownBy(() -> resolver.resolve(Variant.GENERIC, array)).isInstanceOf(ConfigException.class);

            Path number = override("{\"get_price\": 3}");
            assertThatThrownBy(() -> resolver.resolve(Variant.GENERIC, number)).isInstanceOf(ConfigException.class);
        }

        @Test
        @DisplayName("mapping onto a removed call")
        void targetRemoved() throws Exception {
            Path file = override("{\"my_option\": \"set_option\"}");

            assertThatThrownBy(() -> resolver.resolve(Variant.GENERIC, file))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("set_option");
        }

        @Test
        @DisplayName("missing file")
        void missingFile() {
            assertThatThrownBy(() -> resolver.resolve(Variant.GENERIC, tmp.resolve("absent.json")))
                    .isInstanceOf(ConfigException.class);
        }
    }
}
