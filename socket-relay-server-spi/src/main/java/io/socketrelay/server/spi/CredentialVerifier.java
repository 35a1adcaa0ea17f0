package io.socketrelay.server.spi;

import io.socketrelay.core.Identity;
import io.socketrelay.core.RelayException;

/**
 * Resolves a bearer credential to the identity it was issued for.
 *
 * <p>Implementations must be thread-safe; the broker calls them from many connections at once.
 */
@FunctionalInterface
public interface CredentialVerifier {

    /**
     * @param token non-blank bearer credential
     * @return the identity the credential was issued for
     * @throws RelayException.InvalidCredential if the credential is malformed, expired or not trusted
     */
    Identity verify(String token) throws RelayException.InvalidCredential;
}
