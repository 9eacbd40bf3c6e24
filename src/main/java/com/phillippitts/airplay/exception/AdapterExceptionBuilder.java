package com.phillippitts.airplay.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link AdapterException} with contextual details appended to the message.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw AdapterExceptionBuilder.create("Unexpected HTTP status")
 *         .adapter("acoustid")
 *         .status(503)
 *         .durationMs(812)
 *         .metadata("endpoint", "/v2/lookup")
 *         .build();
 * </pre>
 *
 * The resulting message reads {@code {message} (status=503, durationMs=812, endpoint=/v2/lookup)}.
 */
public final class AdapterExceptionBuilder {

    private final String message;
    private String adapterName;
    private Throwable cause;
    private Integer status;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private AdapterExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static AdapterExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new AdapterExceptionBuilder(message);
    }

    public AdapterExceptionBuilder adapter(String adapterName) {
        this.adapterName = adapterName;
        return this;
    }

    public AdapterExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status returned by the remote service.
     */
    public AdapterExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public AdapterExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair; null keys or values are ignored.
     */
    public AdapterExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public AdapterException build() {
        String detailedMessage = buildDetailedMessage();
        String adapter = adapterName != null ? adapterName : "unknown";

        if (cause != null) {
            return new AdapterException(detailedMessage, adapter, cause);
        } else {
            return new AdapterException(detailedMessage, adapter);
        }
    }

    private String buildDetailedMessage() {
        boolean hasDetails = status != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (status != null) {
            sb.append("status=").append(status);
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
