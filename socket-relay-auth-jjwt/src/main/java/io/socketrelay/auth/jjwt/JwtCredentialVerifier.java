package io.socketrelay.auth.jjwt;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.socketrelay.core.Identity;
import io.socketrelay.core.RelayException;
import io.socketrelay.core.Role;
import io.socketrelay.server.spi.CredentialVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link CredentialVerifier} for HMAC-signed JWTs.
 *
 * <p>The identity is read from the {@code id} claim (falling back to {@code sub}), the role from
 * {@code role} and the optional display email from {@code email}.
 */
public final class JwtCredentialVerifier implements CredentialVerifier {
    private static final Logger log = LoggerFactory.getLogger(JwtCredentialVerifier.class);

    public static final String CLAIM_ID = "id";
    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_EMAIL = "email";

    private final JwtParser parser;

    /**
     * @param secret shared HMAC secret; must be at least 32 bytes in UTF-8
     * @throws IllegalArgumentException if the secret is too short
     */
    public JwtCredentialVerifier(String secret) {
        this(hmacKey(secret), Duration.ZERO);
    }

    public JwtCredentialVerifier(SecretKey key, Duration allowedClockSkew) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(allowedClockSkew, "allowedClockSkew");
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clockSkewSeconds(allowedClockSkew.getSeconds())
                .build();
    }

    /**
     * Derives the HMAC key for a shared secret.
     */
    public static SecretKey hmacKey(String secret) {
        Objects.requireNonNull(secret, "secret");
        try {
            return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        } catch (JwtException e) {
            throw new IllegalArgumentException("JWT secret must be at least 256 bits", e);
        }
    }

    @Override
    public Identity verify(String token) throws RelayException.InvalidCredential {
        if (token == null || token.isBlank()) throw new RelayException.InvalidCredential("token is empty");

        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new RelayException.InvalidCredential("token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new RelayException.InvalidCredential("token rejected: " + e.getMessage(), e);
        }

        Object rawId = claims.get(CLAIM_ID);
        String id = rawId != null ? String.valueOf(rawId) : claims.getSubject();
        if (id == null || id.isBlank()) throw new RelayException.InvalidCredential("token has no id claim");

        Role role;
        try {
            role = Role.fromWire(claims.get(CLAIM_ROLE, String.class));
        } catch (IllegalArgumentException e) {
            throw new RelayException.InvalidCredential("token has no valid role claim", e);
        } catch (JwtException e) {
            throw new RelayException.InvalidCredential("role claim is not a string", e);
        }

        String email = claims.get(CLAIM_EMAIL) instanceof String value ? value : null;
        log.debug("Verified token for {} ({})", id, role.wireName());
        return new Identity(id, role, email);
    }
}
