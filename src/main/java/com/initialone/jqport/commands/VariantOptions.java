package com.initialone.jqport.commands;

import com.initialone.jqport.model.ConfigException;
import com.initialone.jqport.symbols.SymbolTable;
import com.initialone.jqport.symbols.Variant;
import com.initialone.jqport.symbols.VariantResolver;
import picocli.CommandLine;

import java.nio.file.Path;

/** --variant / --mapping, shared by every subcommand. */
public class VariantOptions {

    @CommandLine.Option(names = "--variant", defaultValue = "generic",
            description = "Target run mode: generic | simulation | live | factor-only | realtime-data-only"
                    + " (default: ${DEFAULT-VALUE})")
    String variant;

    @CommandLine.Option(names = "--mapping",
            description = "Override file: flat JSON {\"jq_call\": \"ptrade_call\" | null}")
    Path mapping;

    SymbolTable resolve() throws ConfigException {
        return new VariantResolver().resolve(Variant.fromId(variant), mapping);
    }
}
