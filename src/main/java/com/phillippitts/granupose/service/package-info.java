/**
 * Service layer of the control plane.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.engine} - process supervisor, runtime resolution, log buffer and watchdog</li>
 *   <li>{@code service.relay} - validated, rate-limited outbound OSC</li>
 *   <li>{@code service.telemetry} - inbound OSC telemetry: parsing, buffering, fan-out, capture</li>
 *   <li>{@code service.osc} - OSC 1.0 codec and the UDP transport port with its Netty adapter</li>
 *   <li>{@code service.metrics}, {@code service.health} - Micrometer counters and actuator health</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services depend on domain models, not presentation layer</li>
 *   <li>Expected outcomes (rate-limit drops, transport not ready) are results, not exceptions</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 */
package com.phillippitts.granupose.service;
