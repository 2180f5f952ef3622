/**
 * Anomaly lifecycle hooks.
 *
 * <p>Entry points called by the detection engine on anomaly start and end.
 */
package com.mimecast.anomalymail.hook;
