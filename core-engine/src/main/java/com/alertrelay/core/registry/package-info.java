/**
 * Ordered, explicitly constructed name registries shared by the driver,
 * checker, provider, notification and node lookups.
 *
 * @since 1.0.0
 */
package com.alertrelay.core.registry;
