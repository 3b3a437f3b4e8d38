package com.critfumble.fumblebot.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link ProviderException} with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ProviderExceptionBuilder.create("Speech synthesis failed")
 *         .provider("openai")
 *         .statusCode(429)
 *         .durationMs(1200)
 *         .metadata("voice", "onyx")
 *         .build();
 * </pre>
 */
public final class ProviderExceptionBuilder {

    private final String message;
    private String providerName;
    private Throwable cause;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ProviderExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderExceptionBuilder(message);
    }

    public ProviderExceptionBuilder provider(String providerName) {
        this.providerName = providerName;
        return this;
    }

    public ProviderExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status code returned by the provider.
     *
     * @param statusCode HTTP status
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public ProviderExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (statusCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed ProviderException
     */
    public ProviderException build() {
        String detailedMessage = buildDetailedMessage();
        String provider = providerName != null ? providerName : "unknown";

        if (cause != null) {
            return new ProviderException(detailedMessage, provider, cause);
        } else {
            return new ProviderException(detailedMessage, provider);
        }
    }

    private String buildDetailedMessage() {
        boolean hasDetails = statusCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (statusCode != null) {
            sb.append("statusCode=").append(statusCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
