package com.initialone.jqport.fix;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.initialone.jqport.TestScripts.countTopLevelDefs;
import static org.assertj.core.api.Assertions.assertThat;

class LifecycleCheckPassTest {

    private static LifecycleCheckPass pass() {
        Map<String, String> lifecycle = new LinkedHashMap<>();
        lifecycle.put("initialize", "context");
        lifecycle.put("handle_data", "context, data");
        return new LifecycleCheckPass(lifecycle);
    }

    @Test
    @DisplayName("missing lifecycle functions get an empty stub")
    void stubsMissing() {
        assertThat(pass().apply("def initialize(context):\n    pass\n"))
                .isEqualTo("def initialize(context):\n    pass\n\n\ndef handle_data(context, data):\n    pass\n");
    }

    @Test
    @DisplayName("empty text gets every stub")
    void emptyText() {
        String out = pass().apply("");

        assertThat(countTopLevelDefs(out, "initialize")).isEqualTo(1);
        assertThat(countTopLevelDefs(out, "handle_data")).isEqualTo(1);
    }

    @Test
    @DisplayName("a repeated definition is renamed and marked")
    void renamesDuplicate() {
        String out = pass().apply("def initialize(context):\n    pass\n"
                + "def handle_data(context, data):\n    a()\n"
                + "def handle_data(context, data):\n    b()\n");

        assertThat(countTopLevelDefs(out, "handle_data")).isEqualTo(1);
        assertThat(out).contains("def handle_data_duplicate_2(context, data):  # [REVIEW] duplicate handle_data renamed");
    }

    @Test
    @DisplayName("nested defs with a lifecycle name do not count")
    void nestedIgnored() {
        String out = pass().apply("def initialize(context):\n    def handle_data(context, data):\n        pass\n");

        assertThat(countTopLevelDefs(out, "handle_data")).isEqualTo(1);
    }
}
