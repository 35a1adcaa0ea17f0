/**
 * Netty WebSocket transport for the Socket Relay broker, plus the standalone server entry point.
 */
package io.socketrelay.netty;
