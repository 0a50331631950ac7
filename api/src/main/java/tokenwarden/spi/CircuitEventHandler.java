package tokenwarden.spi;

/**
 * SPI for consuming account circuit events.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. The
 * Micrometer handler ({@code metrics}, priority 10) is always installed next to
 * them; {@code logging} (priority 0) ships as a registered extension.
 *
 * <p>Register implementations in:
 * {@code META-INF/services/tokenwarden.spi.CircuitEventHandler}
 */
public interface CircuitEventHandler {

    /**
     * @return handler name (e.g., "logging", "webhook")
     */
    String name();

    default String description() {
        return name() + " circuit event handler";
    }

    /**
     * Higher priority handlers are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle an event. Implementations should not throw; a failure is logged and
     * the remaining handlers still run.
     *
     * @param event the event
     */
    void handle(CircuitEvent event);

    default void close() {}
}
