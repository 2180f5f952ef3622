/**
 * Message templates per anomaly event kind.
 */
package com.mimecast.anomalymail.template;
