/**
 * Analysis providers that turn an incident into remediation recommendations.
 */
package com.alertrelay.pipeline.intelligence;
