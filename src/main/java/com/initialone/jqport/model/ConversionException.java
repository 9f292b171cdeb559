package com.initialone.jqport.model;

/** Fatal conversion failure: nothing has been produced or written. */
public class ConversionException extends Exception {
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
