/**
 * Source drivers: one adapter per monitoring tool's webhook shape.
 *
 * <p>
 * Every driver turns a raw JSON object into a
 * {@link com.alertrelay.core.model.NormalizedPayload}. The shared plumbing
 * (null-safe field access, timestamp parsing, fingerprinting and the
 * validate/parse contract) lives in
 * {@link com.alertrelay.core.driver.AbstractSourceDriver} and its helpers, so
 * each concrete driver holds only its own field-extraction rules.
 * </p>
 *
 * <ul>
 * <li>{@link com.alertrelay.core.driver.AlertmanagerDriver}</li>
 * <li>{@link com.alertrelay.core.driver.GrafanaDriver}</li>
 * <li>{@link com.alertrelay.core.driver.PagerDutyDriver}</li>
 * <li>{@link com.alertrelay.core.driver.DatadogDriver}</li>
 * <li>{@link com.alertrelay.core.driver.NewRelicDriver}</li>
 * <li>{@link com.alertrelay.core.driver.OpsGenieDriver}</li>
 * <li>{@link com.alertrelay.core.driver.ZabbixDriver}</li>
 * <li>{@link com.alertrelay.core.driver.GenericWebhookDriver} (catch-all)</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertrelay.core.driver;
