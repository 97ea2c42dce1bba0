package com.example.talentengine.talent;

/**
 * Raised by modifier variants, the parameter resolver and the skill depot when a
 * modifier cannot be applied. The engine converts it into a failed {@link ApplyResult}.
 */
public class EngineException extends RuntimeException {
    private final EngineError error;

    public EngineException(EngineError error, String message) {
        super(message);
        this.error = error;
    }

    public EngineException(EngineError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public EngineError getError() { return error; }
}
