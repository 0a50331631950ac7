package tokenwarden.adapter.out.telemetry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import tokenwarden.core.port.out.CircuitEventPublisher;
import tokenwarden.spi.CircuitEvent;
import tokenwarden.spi.CircuitEventHandler;

/**
 * Fans circuit events out to handlers on one background thread.
 *
 * <p>The metrics handler is always installed. Further handlers, such as the logging
 * one, come from {@code META-INF/services/tokenwarden.spi.CircuitEventHandler}.
 * Handlers run highest priority first, and every handler sees the events of an
 * account in the order the circuit breaker stored them.
 *
 * <p>With {@code tokenwarden.events.enabled=false} no handler is installed and
 * {@link #publish} is a no-op.
 */
@ApplicationScoped
public class CircuitEventDispatcher implements CircuitEventPublisher {

    private static final Logger LOG = Logger.getLogger(CircuitEventDispatcher.class);

    private static final Comparator<CircuitEventHandler> BY_PRIORITY =
            Comparator.comparingInt(CircuitEventHandler::priority).reversed();

    private final List<CircuitEventHandler> handlers;
    private final ExecutorService worker;

    @Inject
    public CircuitEventDispatcher(
            MeterRegistry meterRegistry,
            @ConfigProperty(name = "tokenwarden.events.enabled", defaultValue = "true") boolean enabled) {
        this(enabled ? installedHandlers(meterRegistry) : List.of());
    }

    CircuitEventDispatcher(List<CircuitEventHandler> candidates) {
        this.handlers = candidates.stream()
                .filter(CircuitEventHandler::isAvailable)
                .sorted(BY_PRIORITY)
                .toList();
        if (handlers.isEmpty()) {
            LOG.info("Circuit event dispatch is off");
            this.worker = null;
            return;
        }
        LOG.infof(
                "Circuit events go to %s",
                handlers.stream().map(h -> h.name() + "@" + h.priority()).toList());
        this.worker = Executors.newSingleThreadExecutor(task -> {
            final var thread = new Thread(task, "circuit-events");
            thread.setDaemon(true);
            return thread;
        });
    }

    static List<CircuitEventHandler> installedHandlers(MeterRegistry meterRegistry) {
        final List<CircuitEventHandler> installed = new ArrayList<>();
        installed.add(new MetricsCircuitEventHandler(meterRegistry));
        ServiceLoader.load(CircuitEventHandler.class).forEach(installed::add);
        return installed;
    }

    @Override
    public void publish(CircuitEvent event) {
        if (worker == null) {
            return;
        }
        try {
            worker.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            LOG.debugf("Dropped %s for account %s during shutdown", event.getClass().getSimpleName(), event.accountId());
        }
    }

    List<CircuitEventHandler> handlers() {
        return handlers;
    }

    private void deliver(CircuitEvent event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                LOG.warnf(
                        "Handler %s failed on %s for account %s: %s",
                        handler.name(), event.getClass().getSimpleName(), event.accountId(), e.getMessage());
            }
        }
    }

    @PreDestroy
    void shutdown() {
        if (worker == null) {
            return;
        }
        worker.shutdown();
        for (var handler : handlers) {
            try {
                handler.close();
            } catch (RuntimeException e) {
                LOG.warnf("Handler %s did not close cleanly: %s", handler.name(), e.getMessage());
            }
        }
    }
}
