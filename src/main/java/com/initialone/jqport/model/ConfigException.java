package com.initialone.jqport.model;

/** Unknown variant, broken built-in table, or a malformed mapping-override file. */
public class ConfigException extends ConversionException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
