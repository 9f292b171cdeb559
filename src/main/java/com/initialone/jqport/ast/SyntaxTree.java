package com.initialone.jqport.ast;

import java.util.List;

/** Parsed script: a MODULE root plus the number of source lines it was built from. */
public final class SyntaxTree {
    private final Node root;
    private final int sourceLines;

    public SyntaxTree(Node root, int sourceLines) {
        if (!root.is(Node.Kind.MODULE)) {
            throw new IllegalArgumentException("root must be a MODULE node, got " + root.kind());
        }
        this.root = root;
        this.sourceLines = sourceLines;
    }

    public Node root() {
        return root;
    }

    public List<Node> statements() {
        return root.body();
    }

    public int sourceLines() {
        return sourceLines;
    }

    public SyntaxTree withStatements(List<Node> statements) {
        return new SyntaxTree(root.withBody(statements), sourceLines);
    }
}
