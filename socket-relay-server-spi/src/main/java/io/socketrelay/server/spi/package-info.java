/**
 * Contracts for the broker's external collaborators: credential verification and the durable
 * chat/room/profile store. The broker treats both as opaque.
 */
package io.socketrelay.server.spi;
