package org.migrata.migration.spi;

/**
 * How a column's values survive a type change.
 */
public enum ConversionSafety {
    /** Same type after normalization; nothing to do. */
    IDENTICAL,
    /** Every old value maps to exactly one new value and back. */
    LOSSLESS,
    /** Some values cannot be represented, or the pair is unknown. */
    LOSSY
}
