package com.influxgate.core.detect;

import com.influxgate.core.dialect.Dialect;
import com.influxgate.core.dialect.DialectCell;
import com.influxgate.core.error.BackendAuthException;
import com.influxgate.core.error.BackendConnectionException;
import com.influxgate.core.error.InfluxGateException;
import com.influxgate.core.error.UnknownVersionException;
import com.influxgate.core.spi.InfluxBackend;
import com.influxgate.core.spi.ProbeEndpoint;
import com.influxgate.core.spi.ProbeStatus;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which dialect the configured server speaks.
 *
 * <p>A configured override wins without any network call. Otherwise the Flux endpoints are
 * probed first, then the InfluxQL ones; each stage pairs an unauthenticated liveness probe with
 * an authenticated confirmation. The first success is stored in the {@link DialectCell}.
 * Authentication and classification failures are remembered and rethrown; connection failures
 * and timeouts are not, so a later call probes again.
 */
public final class VersionDetector {

    private static final Logger log = LoggerFactory.getLogger(VersionDetector.class);

    private final InfluxBackend backend;
    private final Dialect override;
    private final DialectCell cell = new DialectCell();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile InfluxGateException terminalFailure;

    /** @param override the configured dialect, or {@code null} for automatic detection */
    public VersionDetector(InfluxBackend backend, Dialect override) {
        this.backend = backend;
        this.override = override;
        if (override != null) {
            cell.set(override);
        }
    }

    public Dialect resolve() {
        var known = cell.get();
        if (known.isPresent()) {
            return known.get();
        }
        lock.lock();
        try {
            known = cell.get();
            if (known.isPresent()) {
                return known.get();
            }
            if (terminalFailure != null) {
                throw terminalFailure;
            }
            try {
                Dialect detected = detect();
                log.info("Detected InfluxDB dialect {}", detected.wireValue());
                return cell.set(detected);
            } catch (BackendAuthException | UnknownVersionException e) {
                terminalFailure = e;
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /** The resolved dialect, if any, without triggering detection. */
    public Optional<Dialect> current() {
        return cell.get();
    }

    public boolean overridden() {
        return override != null;
    }

    private Dialect detect() {
        Stage flux;
        BackendConnectionException fluxUnreachable = null;
        try {
            flux = stage(ProbeEndpoint.FLUX_READY, ProbeEndpoint.FLUX_BUCKETS, "InfluxDB 2.x");
        } catch (BackendConnectionException e) {
            log.debug("Flux endpoints unreachable: {}", e.getMessage());
            fluxUnreachable = e;
            flux = Stage.ABSENT;
        }
        if (flux == Stage.CONFIRMED) {
            return Dialect.FLUX;
        }
        if (flux == Stage.UNSETTLED) {
            throw unsettled("InfluxDB 2.x");
        }

        Stage influxQl = Stage.ABSENT;
        try {
            influxQl = stage(ProbeEndpoint.INFLUXQL_PING, ProbeEndpoint.INFLUXQL_DATABASES, "InfluxDB 1.x");
        } catch (BackendConnectionException e) {
            if (fluxUnreachable != null) {
                throw new BackendConnectionException("InfluxDB server is unreachable", e);
            }
            log.debug("InfluxQL endpoints unreachable: {}", e.getMessage());
        }
        if (influxQl == Stage.CONFIRMED) {
            return Dialect.INFLUXQL;
        }
        if (influxQl == Stage.UNSETTLED) {
            throw unsettled("InfluxDB 1.x");
        }
        throw new UnknownVersionException(
                "Could not determine the InfluxDB version; set influxgate.version to 1 or 2 explicitly");
    }

    /**
     * Runs one liveness probe and its authenticated confirmation. A server that is alive but
     * answers the confirmation with an unexpected status has not been ruled out. Timeouts
     * propagate.
     */
    private Stage stage(ProbeEndpoint liveness, ProbeEndpoint confirmation, String label) {
        ProbeStatus alive = backend.probe(liveness);
        log.debug("Probe {} -> {}", liveness, alive);
        if (alive != ProbeStatus.OK) {
            return Stage.ABSENT;
        }
        ProbeStatus confirmed = backend.probe(confirmation);
        log.debug("Probe {} -> {}", confirmation, confirmed);
        return switch (confirmed) {
            case OK -> Stage.CONFIRMED;
            case UNAUTHORIZED -> throw new BackendAuthException(
                    "Authentication failed against " + label + "; check the configured credentials", 401);
            case NOT_FOUND -> Stage.ABSENT;
            case UNEXPECTED -> Stage.UNSETTLED;
        };
    }

    private static BackendConnectionException unsettled(String label) {
        return new BackendConnectionException(
                label + " answered its liveness check but failed the confirmation request; will retry", null);
    }

    private enum Stage {
        CONFIRMED,
        ABSENT,
        UNSETTLED
    }
}
