package tokenwarden.adapter.out.telemetry;

import org.jboss.logging.Logger;

import tokenwarden.spi.CircuitEvent;
import tokenwarden.spi.CircuitEventHandler;

/**
 * Circuit event handler that logs events using JBoss Logging.
 *
 * <p>Priority 0. Breaks log at WARN and disables at ERROR. Recoveries and admin
 * resets log at INFO, other health score changes at DEBUG.
 */
public class LoggingCircuitEventHandler implements CircuitEventHandler {

    private static final Logger LOG = Logger.getLogger("tokenwarden.circuit");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs circuit events using JBoss Logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(CircuitEvent event) {
        if (event instanceof CircuitEvent.CircuitBroken broken) {
            final var message = String.format(
                    "%s: account=%s name=%s health=%d episode=%d brokenAt=%s reason=%s",
                    broken.disabled() ? "CIRCUIT_DISABLED" : "CIRCUIT_BROKEN",
                    broken.accountId(),
                    broken.accountName(),
                    broken.healthScore(),
                    broken.episode(),
                    broken.brokenAt(),
                    broken.reason());
            if (broken.disabled()) {
                LOG.error(message);
            } else {
                LOG.warn(message);
            }
        } else if (event instanceof CircuitEvent.CircuitRecovered recovered) {
            LOG.infof(
                    "CIRCUIT_RECOVERED: account=%s name=%s probes=%d after=%ds",
                    recovered.accountId(),
                    recovered.accountName(),
                    recovered.probeCount(),
                    recovered.recoverDuration().toSeconds());
        } else if (event instanceof CircuitEvent.HealthScoreChanged changed) {
            if (changed.cause() == CircuitEvent.HealthScoreChanged.Cause.ADMIN_RESET) {
                LOG.infof(
                        "HEALTH_SCORE_RESET: account=%s name=%s from=%d",
                        changed.accountId(), changed.accountName(), changed.previousScore());
            } else {
                LOG.debugf(
                        "HEALTH_SCORE_CHANGED: account=%s name=%s from=%d to=%d cause=%s",
                        changed.accountId(),
                        changed.accountName(),
                        changed.previousScore(),
                        changed.healthScore(),
                        changed.cause().tag());
            }
        }
    }
}
