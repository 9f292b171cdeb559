package com.initialone.jqport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A line-addressable note about one point of the converted script that needs review.
 * The line always refers to the source script, even when that line no longer exists in the output.
 */
public final class Diagnostic {
    @JsonProperty("line")
    public final int line;
    @JsonProperty("severity")
    public final Severity severity;
    @JsonProperty("message")
    public final String message;

    public Diagnostic(int line, Severity severity, String message) {
        this.line = line;
        this.severity = Objects.requireNonNull(severity);
        this.message = Objects.requireNonNull(message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic d = (Diagnostic) o;
        return line == d.line && severity == d.severity && message.equals(d.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, severity, message);
    }

    @Override
    public String toString() {
        return "line " + line + " [" + severity.label() + "] " + message;
    }
}
