/**
 * Health-check collaborator contract.
 *
 * <p>
 * Concrete probes live outside this library; the engine only depends on
 * {@link com.alertrelay.core.check.Checker} and the
 * {@link com.alertrelay.core.check.CheckResult} it returns.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertrelay.core.check;
