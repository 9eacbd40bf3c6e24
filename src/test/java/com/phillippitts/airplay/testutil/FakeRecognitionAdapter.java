package com.phillippitts.airplay.testutil;

import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.service.adapter.CircuitBreaker;
import com.phillippitts.airplay.service.adapter.RecognitionAdapter;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.adapter.RecognitionOutcome;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Configurable adapter double that counts its calls.
 */
public class FakeRecognitionAdapter implements RecognitionAdapter {

    private final String name;
    private final DetectionSource source;
    private volatile boolean enabled = true;
    private volatile Function<RecognitionInput, RecognitionOutcome> behavior;
    private final AtomicInteger calls = new AtomicInteger();

    public FakeRecognitionAdapter(String name, DetectionSource source, RecognitionOutcome outcome) {
        this.name = name;
        this.source = source;
        this.behavior = in -> outcome;
    }

    public FakeRecognitionAdapter answering(Function<RecognitionInput, RecognitionOutcome> behavior) {
        this.behavior = behavior;
        return this;
    }

    public FakeRecognitionAdapter returning(RecognitionOutcome outcome) {
        this.behavior = in -> outcome;
        return this;
    }

    public FakeRecognitionAdapter disabled() {
        this.enabled = false;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DetectionSource source() {
        return source;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public RecognitionOutcome identify(RecognitionInput input) {
        calls.incrementAndGet();
        return behavior.apply(input);
    }

    @Override
    public CircuitBreaker.State circuitState() {
        return CircuitBreaker.State.CLOSED;
    }
}
