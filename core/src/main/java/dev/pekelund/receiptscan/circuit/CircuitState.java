package dev.pekelund.receiptscan.circuit;

/**
 * States of a per-operation circuit breaker.
 */
public enum CircuitState {
    /** Calls pass through and failures are counted. */
    CLOSED,
    /** Calls are rejected until the cool-down has elapsed. */
    OPEN,
    /** A single trial call decides whether the circuit closes again. */
    HALF_OPEN
}
