/**
 * Sequential pipeline execution and its run summary.
 */
package com.alertrelay.pipeline.executor;
