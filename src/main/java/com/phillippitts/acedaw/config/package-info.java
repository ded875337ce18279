/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.acedaw.config.StorageConfig} - key-value substrate selection
 *       and the timestamp clock</li>
 *   <li>{@link com.phillippitts.acedaw.config.ThreadPoolConfig} - executor for blocking storage
 *       I/O with MDC propagation</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code acedaw.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.acedaw.config;
