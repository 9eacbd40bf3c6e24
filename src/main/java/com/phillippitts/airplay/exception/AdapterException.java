package com.phillippitts.airplay.exception;

/**
 * Thrown when an external recognition service call fails (transport error,
 * unexpected HTTP status, unparseable payload).
 */
public class AdapterException extends AirplayException {

    private final String adapterName;

    public AdapterException(String message) {
        super(message);
        this.adapterName = "unknown";
    }

    public AdapterException(String message, String adapterName) {
        super(message + " (adapter: " + adapterName + ")");
        this.adapterName = adapterName;
    }

    public AdapterException(String message, Throwable cause) {
        super(message, cause);
        this.adapterName = "unknown";
    }

    public AdapterException(String message, String adapterName, Throwable cause) {
        super(message + " (adapter: " + adapterName + ")", cause);
        this.adapterName = adapterName;
    }

    public String getAdapterName() {
        return adapterName;
    }
}
