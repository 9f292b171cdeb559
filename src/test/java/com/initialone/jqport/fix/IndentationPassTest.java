package com.initialone.jqport.fix;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IndentationPassTest {

    private final IndentationPass pass = new IndentationPass();

    @Test
    @DisplayName("two-space blocks become four-space blocks")
    void twoSpaces() {
        assertThat(pass.apply("def f():\n  if x:\n    y = 1\n  return y\n"))
                .isEqualTo("def f():\n    if x:\n        y = 1\n    return y\n");
    }

    @Test
    @DisplayName("width between two levels snaps to the nearer one")
    void snapsOddWidth() {
        assertThat(pass.apply("def f():\n    a = 1\n   b = 2\n")).isEqualTo("def f():\n    a = 1\n    b = 2\n");
    }

    @Test
    @DisplayName("missing indentation after a header is added")
    void missingIndent() {
        assertThat(pass.apply("def f():\nreturn 1\n")).isEqualTo("def f():\n    return 1\n");
    }

    @Test
    @DisplayName("continuation lines move with their statement")
    void continuation() {
        assertThat(pass.apply("def f():\n  x = g(a,\n        b)\n"))
                .isEqualTo("def f():\n    x = g(a,\n          b)\n");
    }

    @Test
    @DisplayName("triple-quoted string bodies are left as they are")
    void tripleQuoted() {
        String in = "def f():\n    s = '''\n  keep\n'''\n    return s\n";

        assertThat(pass.apply(in)).isEqualTo(in);
    }

    @Test
    @DisplayName("idempotent")
    void idempotent() {
        String once = pass.apply("class A:\n  def m(self):\n     if x:\n         pass\n     # note\n     return 1\n");

        assertThat(pass.apply(once)).isEqualTo(once);
    }
}
