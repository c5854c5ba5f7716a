package com.myfinancehub.ledger.security;

import com.myfinancehub.ledger.config.LedgerProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Issues the HS256 bearer tokens accepted by the resource server. The subject is the username.
 */
@Service
public class JwtIssuerService {

    public static final String ISSUER = "myfinancehub";

    private final SecretKey key;
    private final long ttlSeconds;
    private final Clock clock;

    @Autowired
    public JwtIssuerService(LedgerProperties properties) {
        this(properties, Clock.systemUTC());
    }

    JwtIssuerService(LedgerProperties properties, Clock clock) {
        if (!properties.security().hasJwtSecret()) {
            throw new IllegalStateException("jwtSecret must be configured");
        }
        byte[] bytes = properties.security().jwtSecret().getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) { // HS256 needs at least 256-bit secret
            throw new IllegalStateException("jwtSecret must be at least 32 bytes");
        }
        this.key = Keys.hmacShaKeyFor(bytes);
        this.ttlSeconds = properties.security().tokenTtlSeconds();
        this.clock = clock;
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }

    public String issue(String username) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(username)
                .setIssuer(ISSUER)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }
}
