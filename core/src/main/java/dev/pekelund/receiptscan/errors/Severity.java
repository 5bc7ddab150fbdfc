package dev.pekelund.receiptscan.errors;

/**
 * Severity attached to a classified failure.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
