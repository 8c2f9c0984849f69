package com.alari.companion.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.alari.companion.TestProperties;
import com.alari.companion.config.AlariProperties;
import com.alari.companion.config.SecurityConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtValidationException;

public class JwtIssuerServiceTest {

    private final AlariProperties props = TestProperties.defaults();

    @Test
    void issuedTokenCarriesUserIdEmailAndSevenDayExpiry() {
        Instant now = Instant.now();
        JwtIssuerService issuer = new JwtIssuerService(props, Clock.fixed(now, ZoneOffset.UTC));

        JwtIssuerService.IssuedToken issued = issuer.issue(42L, "ana@example.com");

        assertTrue(issued.token().split("\\.").length == 3, "should be a JWT");
        assertEquals(now.plus(Duration.ofDays(7)), issued.expiresAt());

        Jwt decoded = new SecurityConfig().jwtDecoder(props).decode(issued.token());
        assertEquals("42", decoded.getSubject());
        assertEquals("ana@example.com", decoded.getClaimAsString("email"));
        assertEquals("alari-companion", decoded.getClaimAsString("iss"));
    }

    @Test
    void expiredTokenIsRejectedByDecoder() {
        Instant longAgo = Instant.now().minus(Duration.ofDays(30));
        JwtIssuerService issuer = new JwtIssuerService(props, Clock.fixed(longAgo, ZoneOffset.UTC));
        String token = issuer.issue(7L, "old@example.com").token();

        JwtValidationException ex = assertThrows(JwtValidationException.class,
                () -> new SecurityConfig().jwtDecoder(props).decode(token));
        assertTrue(ex.getMessage().toLowerCase(Locale.ROOT).contains("expired"));
    }

    @Test
    void tokenFromAnotherIssuerIsRejected() {
        AlariProperties other = new AlariProperties(
                new AlariProperties.Security(TestProperties.SECRET, null, "someone-else"),
                props.inference(), props.chat(), props.cors());
        String token = new JwtIssuerService(other).issue(1L, "x@example.com").token();

        assertThrows(JwtValidationException.class, () -> new SecurityConfig().jwtDecoder(props).decode(token));
    }

    @Test
    void nullUserIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new JwtIssuerService(props).issue(null, "x@example.com"));
    }
}
