package com.initialone.jqport.merge;

import com.initialone.jqport.ast.Node;

import java.util.List;

/** One top-level function of the source script, with the comment lines written directly above it. */
public final class FunctionBody {
    private final Node definition;
    private final List<Node> leadingComments;

    public FunctionBody(Node definition, List<Node> leadingComments) {
        if (!definition.is(Node.Kind.FUNCTION_DEF)) {
            throw new IllegalArgumentException("not a function definition: " + definition);
        }
        this.definition = definition;
        this.leadingComments = List.copyOf(leadingComments);
    }

    public String name() {
        return definition.text();
    }

    public int line() {
        return definition.line();
    }

    public Node definition() {
        return definition;
    }

    public List<Node> leadingComments() {
        return leadingComments;
    }

    public FunctionBody withDefinition(Node newDefinition) {
        return new FunctionBody(newDefinition, leadingComments);
    }

    @Override
    public String toString() {
        return "FunctionBody(" + name() + "@" + line() + ")";
    }
}
