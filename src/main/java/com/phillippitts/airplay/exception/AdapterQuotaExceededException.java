package com.phillippitts.airplay.exception;

/**
 * Thrown when an adapter's local quota for the current window is used up, or when the
 * remote service answers with a rate-limit status. No call is attempted in the first case.
 */
public class AdapterQuotaExceededException extends AdapterException {

    private final int limit;

    public AdapterQuotaExceededException(String adapterName, int limit) {
        super("Quota of " + limit + " calls per window exhausted", adapterName);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
