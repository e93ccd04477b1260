package com.alertrelay.core.check;

/**
 * A single health probe (CPU, disk, a remote endpoint, ...).
 *
 * <p>
 * Implementations should report bad readings through the returned status
 * rather than by throwing. Callers still treat a thrown exception as an
 * {@link CheckStatus#UNKNOWN} result.
 * </p>
 *
 * @since 1.0.0
 */
public interface Checker {

    /**
     * @return registry name, e.g. {@code disk}
     */
    String name();

    CheckResult check();
}
