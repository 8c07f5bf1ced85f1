package com.herzen.migration.extract;

public class MarkupParseException extends Exception {
    public MarkupParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
