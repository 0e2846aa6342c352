/**
 * Application-wide configuration beans and properties.
 *
 * <p>Properties are bound once at startup from {@code application.properties}, validated, and
 * passed by reference into the components that need them.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.remote} - remote classifier endpoint, timeouts and retries</li>
 *   <li>{@code config.labeling} - labeling mode, trigger thresholds and label acceptance</li>
 * </ul>
 *
 * @see com.structura.labeling.config.remote.RemoteClassifierProperties
 * @see com.structura.labeling.config.labeling.LabelingProperties
 */
package com.structura.labeling.config;
