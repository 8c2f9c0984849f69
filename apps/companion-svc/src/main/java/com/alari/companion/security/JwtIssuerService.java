package com.alari.companion.security;

import com.alari.companion.config.AlariProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class JwtIssuerService {

    private final SecretKey key;
    private final Duration ttl;
    private final String issuer;
    private final Clock clock;

    @Autowired
    public JwtIssuerService(AlariProperties properties) {
        this(properties, Clock.systemUTC());
    }

    JwtIssuerService(AlariProperties properties, Clock clock) {
        this.key = Keys.hmacShaKeyFor(properties.security().jwtSecret().getBytes(StandardCharsets.UTF_8));
        this.ttl = properties.security().tokenTtl();
        this.issuer = properties.security().issuer();
        this.clock = clock;
    }

    public IssuedToken issue(Long userId, String email) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        String token = Jwts.builder()
                .subject(userId.toString())
                .claim("email", email)
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
        return new IssuedToken(token, expiresAt);
    }

    public record IssuedToken(String token, Instant expiresAt) {}
}
