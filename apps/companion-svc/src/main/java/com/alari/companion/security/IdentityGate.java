package com.alari.companion.security;

import com.alari.companion.user.UserRepository;
import java.util.Optional;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Resolves the bearer token validated by the resource server into a durable user identity.
 * Signature and expiry are checked before this point; here the subject must name an existing user.
 */
@Component
public class IdentityGate {

    private final UserRepository userRepository;

    public IdentityGate(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Identity authenticate() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof JwtAuthenticationToken jwtAuthentication) {
            return authenticate(jwtAuthentication.getToken());
        }
        throw new AuthException(AuthException.Reason.MISSING_TOKEN, "Bearer token required");
    }

    public Identity authenticate(Jwt token) {
        Long userId = parseSubject(token.getSubject())
                .orElseThrow(() -> new AuthException(AuthException.Reason.MALFORMED_TOKEN, "Token subject is not a user id"));
        Identity identity = userRepository.findById(userId)
                .map(user -> new Identity(user.getId(), user.getEmail(), user.getUserName()))
                .orElseThrow(() -> new AuthException(AuthException.Reason.UNKNOWN_SUBJECT, "Could not validate credentials"));
        RequestContextHolder.setUserId(identity.id());
        return identity;
    }

    static Optional<Long> parseSubject(String subject) {
        if (subject == null || subject.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(subject));
        } catch (NumberFormatException ignored) {
            return Optional.empty();
        }
    }
}
