package com.myfinancehub.ledger.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.myfinancehub.ledger.config.LedgerProperties;
import com.myfinancehub.ledger.config.SecurityConfig;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;

class JwtIssuerServiceTest {

    private static final String SECRET = "12345678901234567890123456789012";

    private static LedgerProperties props(String secret, Long ttl) {
        return new LedgerProperties(null, null, null, new LedgerProperties.Security(secret, ttl));
    }

    @Test
    void issuedTokenIsAcceptedByDecoder() {
        LedgerProperties props = props(SECRET, 60L);
        JwtIssuerService issuer = new JwtIssuerService(props);

        String token = issuer.issue("alice");
        Jwt jwt = new SecurityConfig().jwtDecoder(props).decode(token);

        assertThat(token.split("\\.")).hasSize(3);
        assertThat(jwt.getSubject()).isEqualTo("alice");
        assertThat(jwt.getClaimAsString("iss")).isEqualTo(JwtIssuerService.ISSUER);
        assertThat(issuer.ttlSeconds()).isEqualTo(60L);
    }

    @Test
    void expiredTokenIsRejected() {
        LedgerProperties props = props(SECRET, 60L);
        Clock past = Clock.fixed(Instant.now().minusSeconds(3600), ZoneOffset.UTC);
        String token = new JwtIssuerService(props, past).issue("alice");
        JwtDecoder decoder = new SecurityConfig().jwtDecoder(props);

        assertThatThrownBy(() -> decoder.decode(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void tokenSignedWithOtherSecretIsRejected() {
        String token = new JwtIssuerService(props("abcdefghijklmnopqrstuvwxyz012345", 60L)).issue("mallory");
        JwtDecoder decoder = new SecurityConfig().jwtDecoder(props(SECRET, 60L));

        assertThatThrownBy(() -> decoder.decode(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void tooShortSecretRejected() {
        assertThatThrownBy(() -> new JwtIssuerService(props("shortsecret", null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32");
    }

    @Test
    void missingSecretRejected() {
        assertThatThrownBy(() -> new JwtIssuerService(props(null, null)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new SecurityConfig().jwtDecoder(props(" ", null)))
                .isInstanceOf(IllegalStateException.class);
    }
}
