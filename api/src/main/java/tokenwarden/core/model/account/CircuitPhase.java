package tokenwarden.core.model.account;

/**
 * Derived phase of an account's circuit.
 */
public enum CircuitPhase {
    CLOSED,
    BROKEN,
    HALF_OPEN
}
