/**
 * Transport-neutral server core for Socket Relay.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.socketrelay.server.core.RelayBroker} (the broker service object and its builder)</li>
 *   <li>Shared connection state: {@link io.socketrelay.server.core.ConnectionRegistry},
 *       {@link io.socketrelay.server.core.LocationSubscriptions}, {@link io.socketrelay.server.core.LocationBook}</li>
 *   <li>{@link io.socketrelay.server.core.LivenessMonitor} and {@link io.socketrelay.server.core.PresenceBroadcaster}</li>
 *   <li>{@link io.socketrelay.server.core.MessageRouter} with per-event handlers</li>
 *   <li>{@link io.socketrelay.server.core.InMemoryChatStore} (reference store)</li>
 * </ul>
 *
 * <p>Transport integrations implement {@link io.socketrelay.server.core.ConnectionChannel} and feed
 * frames, pongs and closes into the broker.
 */
package io.socketrelay.server.core;
