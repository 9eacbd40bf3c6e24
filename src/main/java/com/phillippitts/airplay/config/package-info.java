/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.airplay.config.ThreadPoolConfig} - bounded pipeline pool and
 *       event offload pool, both propagating the Log4j2 ThreadContext</li>
 *   <li>{@link com.phillippitts.airplay.config.PipelineConfig} - stores, registry, adapters,
 *       detection tiers, scheduler and health wiring</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code airplay.*} and {@code threadpool.*} properties</li>
 * </ul>
 */
package com.phillippitts.airplay.config;
