package com.influxgate.core.dialect;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Write-once holder for the detected dialect. Unknown until {@link #set} succeeds; later writes
 * are ignored and the first value wins.
 */
public final class DialectCell {

    private final AtomicReference<Dialect> value = new AtomicReference<>();

    public Optional<Dialect> get() {
        return Optional.ofNullable(value.get());
    }

    public boolean isResolved() {
        return value.get() != null;
    }

    /** Stores {@code dialect} if nothing is stored yet and returns whichever value is now held. */
    public Dialect set(Dialect dialect) {
        if (dialect == null) {
            throw new IllegalArgumentException("dialect");
        }
        value.compareAndSet(null, dialect);
        return value.get();
    }
}
