/**
 * Protocol-centric core for Socket Relay.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants (event tags, error texts, logical paths)</li>
 *   <li>Small identity models ({@link io.socketrelay.core.Identity}, {@link io.socketrelay.core.Role})</li>
 *   <li>The inbound wire DTO and its typed, validated variants</li>
 *   <li>The outbound envelope shape</li>
 * </ul>
 *
 * <p>Socket bindings, JSON libraries and persistence live in other modules.
 */
package io.socketrelay.core;
