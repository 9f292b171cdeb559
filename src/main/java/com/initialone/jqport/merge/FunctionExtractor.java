package com.initialone.jqport.merge;

import com.initialone.jqport.ast.Node;
import com.initialone.jqport.ast.ScriptPrinter;
import com.initialone.jqport.ast.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/** Splits a tree into top-level functions and everything else. Pure; the tree is not modified. */
public final class FunctionExtractor {

    private FunctionExtractor() {
    }

    public static ExtractedScript extract(SyntaxTree tree) {
        List<Node> preamble = new ArrayList<>();
        List<FunctionBody> functions = new ArrayList<>();
        for (Node s : tree.statements()) {
            if (!s.is(Node.Kind.FUNCTION_DEF)) {
                preamble.add(s);
                continue;
            }
            // 紧贴在 def 上方的注释跟着函数走
            int start = preamble.size();
            while (start > 0 && preamble.get(start - 1).is(Node.Kind.COMMENT)
                    && !preamble.get(start - 1).text().startsWith(ScriptPrinter.REVIEW_MARK)) {
                start--;
            }
            List<Node> comments = new ArrayList<>(preamble.subList(start, preamble.size()));
            preamble.subList(start, preamble.size()).clear();
            functions.add(new FunctionBody(s, comments));
        }
        return new ExtractedScript(preamble, functions);
    }
}
