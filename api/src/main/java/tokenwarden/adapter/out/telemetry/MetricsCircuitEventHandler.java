package tokenwarden.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import tokenwarden.spi.CircuitEvent;
import tokenwarden.spi.CircuitEventHandler;

/**
 * Records circuit events as Micrometer metrics.
 *
 * <p>Always installed by {@link CircuitEventDispatcher}, which owns the registry;
 * it is not a {@link java.util.ServiceLoader} extension.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tokenwarden.circuit.events} - Events by type</li>
 *   <li>{@code tokenwarden.circuit.broken} - Breaks by episode and whether the account was disabled</li>
 *   <li>{@code tokenwarden.circuit.recovery} - Time from first break to recovery</li>
 *   <li>{@code tokenwarden.health.changes} - Health score changes by cause</li>
 *   <li>{@code tokenwarden.health.score} - Health scores reached by those changes</li>
 * </ul>
 */
public class MetricsCircuitEventHandler implements CircuitEventHandler {

    static final int PRIORITY = 10;

    private final MeterRegistry registry;

    public MetricsCircuitEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public String description() {
        return "Records circuit events as Micrometer metrics";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public void handle(CircuitEvent event) {
        Counter.builder("tokenwarden.circuit.events")
                .description("Circuit transitions")
                .tag("event_type", event.getClass().getSimpleName())
                .register(registry)
                .increment();

        if (event instanceof CircuitEvent.CircuitBroken broken) {
            Counter.builder("tokenwarden.circuit.broken")
                    .description("Circuit breaks")
                    .tag("episode", String.valueOf(broken.episode()))
                    .tag("disabled", String.valueOf(broken.disabled()))
                    .register(registry)
                    .increment();
        } else if (event instanceof CircuitEvent.CircuitRecovered recovered) {
            Timer.builder("tokenwarden.circuit.recovery")
                    .description("Time from first break to recovery")
                    .register(registry)
                    .record(recovered.recoverDuration());
        } else if (event instanceof CircuitEvent.HealthScoreChanged changed) {
            Counter.builder("tokenwarden.health.changes")
                    .description("Account health score changes")
                    .tag("cause", changed.cause().tag())
                    .register(registry)
                    .increment();
            DistributionSummary.builder("tokenwarden.health.score")
                    .description("Health score after a change")
                    .register(registry)
                    .record(changed.healthScore());
        }
    }
}
