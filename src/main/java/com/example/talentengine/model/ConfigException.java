package com.example.talentengine.model;

/**
 * A configuration record is structurally invalid (unknown kind tag, missing required field).
 * Loaders catch it per record, log it and keep going.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
