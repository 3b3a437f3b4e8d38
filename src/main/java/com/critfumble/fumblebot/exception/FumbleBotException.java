package com.critfumble.fumblebot.exception;

/**
 * Base exception for all FumbleBot voice application errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class FumbleBotException extends RuntimeException {

    public FumbleBotException(String message) {
        super(message);
    }

    public FumbleBotException(String message, Throwable cause) {
        super(message, cause);
    }

    public FumbleBotException(Throwable cause) {
        super(cause);
    }
}
