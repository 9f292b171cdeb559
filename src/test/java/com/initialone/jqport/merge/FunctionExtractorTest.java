package com.initialone.jqport.merge;

import com.initialone.jqport.ast.Node;
import com.initialone.jqport.ast.ScriptParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FunctionExtractorTest {

    @Test
    @DisplayName("functions in source order, later definitions win, comments travel with their def")
    void extracts() throws Exception {
        String src = ""
                + "import os\n"
                + "\n"
                + "# helper doc\n"
                + "def a():\n"
                + "    pass\n"
                + "\n"
                + "X = 1\n"
                + "\n"
                + "def b():\n"
                + "    pass\n"
                + "\n"
                + "def a():\n"
                + "    return 1\n";

        ExtractedScript script = FunctionExtractor.extract(ScriptParser.parse(src));

        assertThat(script.definitions()).extracting(FunctionBody::name).containsExactly("a", "b", "a");
        assertThat(script.functions()).containsOnlyKeys("a", "b");
        assertThat(script.functions().keySet()).containsExactly("a", "b");
        assertThat(script.functions().get("a").line()).isEqualTo(12);
        assertThat(script.overridden()).extracting(FunctionBody::line).containsExactly(4);
        assertThat(script.definitions().get(0).leadingComments()).extracting(Node::text).containsExactly("# helper doc");
        assertThat(script.preamble()).extracting(Node::kind).contains(Node.Kind.SIMPLE_STMT, Node.Kind.ASSIGN)
                .doesNotContain(Node.Kind.COMMENT, Node.Kind.FUNCTION_DEF);
    }

    @Test
    @DisplayName("review comments stay in the preamble")
    void reviewCommentsStay() throws Exception {
        ExtractedScript script = FunctionExtractor.extract(
                ScriptParser.parse("# [REVIEW] removed import: from jqdata import *\ndef f():\n    pass\n"));

        assertThat(script.functions().get("f").leadingComments()).isEmpty();
        assertThat(script.preamble()).extracting(Node::kind).containsExactly(Node.Kind.COMMENT);
    }
}
