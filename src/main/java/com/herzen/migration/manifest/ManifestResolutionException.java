package com.herzen.migration.manifest;

public class ManifestResolutionException extends RuntimeException {
    private final String code;

    public ManifestResolutionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ManifestResolutionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
