/**
 * JWT bearer-credential verification backed by JJWT.
 */
package io.socketrelay.auth.jjwt;
