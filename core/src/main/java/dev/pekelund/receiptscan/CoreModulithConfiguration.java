package dev.pekelund.receiptscan;

/**
 * Anchor type for the resilience core. Its package is the root the module verification scans.
 */
public final class CoreModulithConfiguration {

    private CoreModulithConfiguration() {
    }
}
