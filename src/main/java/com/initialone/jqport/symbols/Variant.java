package com.initialone.jqport.symbols;

import com.initialone.jqport.model.ConfigException;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Target run mode; selects the call table and structural template. */
public enum Variant {
    GENERIC("generic"),
    SIMULATION("simulation"),
    LIVE("live"),
    FACTOR_ONLY("factor-only"),
    REALTIME_DATA_ONLY("realtime-data-only");

    private final String id;

    Variant(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Variant fromId(String id) throws ConfigException {
        for (Variant v : values()) {
            if (v.id.equalsIgnoreCase(id) || v.name().equalsIgnoreCase(id)) return v;
        }
        throw new ConfigException("unknown variant '" + id + "', expected one of "
                + Arrays.stream(values()).map(Variant::id).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return id;
    }
}
