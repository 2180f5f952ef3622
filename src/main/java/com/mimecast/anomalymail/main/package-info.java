/**
 * Process-wide configuration and pluggable component factories.
 */
package com.mimecast.anomalymail.main;
