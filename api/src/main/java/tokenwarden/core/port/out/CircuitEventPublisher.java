package tokenwarden.core.port.out;

import tokenwarden.spi.CircuitEvent;

/**
 * Outbound port for circuit transition events.
 */
public interface CircuitEventPublisher {

    /**
     * Publish an event. Must not block the caller.
     *
     * @param event the event
     */
    void publish(CircuitEvent event);
}
