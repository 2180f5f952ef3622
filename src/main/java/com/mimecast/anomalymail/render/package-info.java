/**
 * Renders message templates with named parameters.
 *
 * <p>Placeholders look like <code>{model}</code> and are replaced with the parameter text.
 * <br>A placeholder without a matching parameter is a rendering error.
 */
package com.mimecast.anomalymail.render;
