package dev.pekelund.receiptscan.recovery;

/**
 * Checks whether an external dependency can be reached.
 */
@FunctionalInterface
public interface ConnectivityProbe {

    boolean isReachable() throws Exception;
}
