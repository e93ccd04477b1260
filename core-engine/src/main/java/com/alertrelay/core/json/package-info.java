/**
 * Jackson plumbing for raw webhook bodies.
 */
package com.alertrelay.core.json;
