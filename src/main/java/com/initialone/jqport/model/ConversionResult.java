package com.initialone.jqport.model;

import java.util.List;

/** Output of one conversion run: the complete target script plus every review note. */
public final class ConversionResult {
    private final String outputText;
    private final List<Diagnostic> diagnostics;

    public ConversionResult(String outputText, List<Diagnostic> diagnostics) {
        this.outputText = outputText;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String outputText() {
        return outputText;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity != Severity.INFO);
    }
}
