package com.phillippitts.airplay.service.adapter;

import com.phillippitts.airplay.config.properties.AdapterProperties;
import com.phillippitts.airplay.exception.AdapterException;
import com.phillippitts.airplay.exception.AdapterQuotaExceededException;
import com.phillippitts.airplay.exception.AdapterTimeoutException;
import com.phillippitts.airplay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for recognition adapters providing the shared call protocol.
 *
 * <p>This class implements the Template Method pattern. {@link #identify(RecognitionInput)} is
 * final and runs, in order:
 * <ol>
 *   <li>{@link #supports(RecognitionInput)}: inputs the service cannot use are an honest NO_MATCH
 *       and consume neither quota nor circuit budget</li>
 *   <li>circuit breaker permission, refused with CIRCUIT_OPEN</li>
 *   <li>local quota, refused with QUOTA_EXCEEDED before any network call</li>
 *   <li>{@link #doIdentify(RecognitionInput)}, whose failures are classified as TIMEOUT or ERROR,
 *       counted by the breaker and published as {@link AdapterFailureEvent}</li>
 * </ol>
 *
 * <p>There are no internal retries; the cascade moves on to the next tier instead.
 *
 * <p><b>Thread Safety:</b> adapters are shared by all pipeline workers. Breaker and quota are
 * thread-safe; subclasses must keep {@link #doIdentify} free of mutable state.
 */
public abstract class AbstractRecognitionAdapter implements RecognitionAdapter {

    private static final Logger LOG = LogManager.getLogger(AbstractRecognitionAdapter.class);

    private final AdapterProperties.Endpoint endpoint;
    private final CircuitBreaker circuitBreaker;
    private final QuotaGuard quotaGuard;
    private final ApplicationEventPublisher publisher;

    protected AbstractRecognitionAdapter(String name,
                                         AdapterProperties.Endpoint endpoint,
                                         ApplicationEventPublisher publisher,
                                         Clock clock) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        AdapterProperties.Circuit circuit = endpoint.getCircuit();
        this.circuitBreaker = new CircuitBreaker(name, circuit.getFailureThreshold(), circuit.getWindow(),
                circuit.getCooldown(), clock);
        this.quotaGuard = new QuotaGuard(name, endpoint.getQuotaLimit(), endpoint.getQuotaWindow(), publisher, clock);
    }

    @Override
    public boolean isEnabled() {
        return endpoint.isEnabled() && hasCredentials();
    }

    @Override
    public final RecognitionOutcome identify(RecognitionInput input) {
        Objects.requireNonNull(input, "input");
        if (!isEnabled()) {
            return RecognitionOutcome.noMatch("disabled");
        }
        if (!supports(input)) {
            return RecognitionOutcome.noMatch("input not usable by " + name());
        }
        if (!circuitBreaker.tryAcquire()) {
            LOG.debug("{} circuit open; skipping call", name());
            return RecognitionOutcome.of(RecognitionOutcome.Kind.CIRCUIT_OPEN, "circuit open");
        }
        if (!quotaGuard.tryAcquire()) {
            circuitBreaker.release();
            return RecognitionOutcome.of(RecognitionOutcome.Kind.QUOTA_EXCEEDED, "local quota exhausted");
        }

        long start = System.nanoTime();
        try {
            RecognitionOutcome outcome = doIdentify(input);
            circuitBreaker.onSuccess();
            LOG.debug("{} answered {} in {}ms", name(), outcome.kind(), TimeUtils.elapsedMillis(start));
            return outcome;
        } catch (AdapterQuotaExceededException e) {
            // remote quota: the service is up, so the breaker is not charged
            circuitBreaker.release();
            publishFailure(RecognitionOutcome.Kind.QUOTA_EXCEEDED, e, start);
            return RecognitionOutcome.of(RecognitionOutcome.Kind.QUOTA_EXCEEDED, e.getMessage());
        } catch (AdapterTimeoutException e) {
            return fail(RecognitionOutcome.Kind.TIMEOUT, e, start);
        } catch (AdapterException e) {
            return fail(RecognitionOutcome.Kind.ERROR, e, start);
        } catch (RuntimeException e) {
            LOG.error("{} failed unexpectedly", name(), e);
            return fail(RecognitionOutcome.Kind.ERROR, e, start);
        }
    }

    @Override
    public CircuitBreaker.State circuitState() {
        return circuitBreaker.state();
    }

    /** Calls left in the current quota window. */
    public int remainingQuota() {
        return quotaGuard.remaining();
    }

    protected AdapterProperties.Endpoint endpoint() {
        return endpoint;
    }

    /**
     * Credentials required by the service are present. Defaults to the API key.
     */
    protected boolean hasCredentials() {
        return endpoint.hasApiKey();
    }

    /**
     * Whether the input carries what this service needs (stream title, fingerprint, audio).
     */
    protected abstract boolean supports(RecognitionInput input);

    /**
     * Performs the service call.
     *
     * <p><b>Contract:</b>
     * <ul>
     *   <li>Returns MATCH or NO_MATCH only</li>
     *   <li>Throws {@link AdapterTimeoutException} on timeouts, {@link AdapterQuotaExceededException}
     *       when the service reports its own quota exhausted, {@link AdapterException} otherwise</li>
     * </ul>
     */
    protected abstract RecognitionOutcome doIdentify(RecognitionInput input);

    private RecognitionOutcome fail(RecognitionOutcome.Kind kind, RuntimeException e, long start) {
        if (Thread.currentThread().isInterrupted()) {
            // poll deadline, not the service's fault
            circuitBreaker.release();
            return RecognitionOutcome.of(RecognitionOutcome.Kind.ERROR, "interrupted");
        }
        circuitBreaker.onFailure();
        LOG.warn("{} call failed ({}): {}", name(), kind, e.getMessage());
        publishFailure(kind, e, start);
        return RecognitionOutcome.of(kind, e.getMessage());
    }

    private void publishFailure(RecognitionOutcome.Kind kind, RuntimeException e, long start) {
        publisher.publishEvent(new AdapterFailureEvent(
                name(),
                kind,
                null,
                e.getMessage(),
                e,
                Map.of("durationMs", String.valueOf(TimeUtils.elapsedMillis(start)),
                        "exception", e.getClass().getSimpleName())
        ));
    }
}
