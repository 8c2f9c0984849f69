package com.alari.companion.auth;

import com.alari.companion.security.AuthException;
import com.alari.companion.security.Identity;
import com.alari.companion.security.JwtIssuerService;
import com.alari.companion.user.UserDeletionService;
import com.alari.companion.user.UserEntity;
import com.alari.companion.user.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Account lifecycle: registration, password login and self-service deletion.
 */
@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final int MIN_PASSWORD_LENGTH = 8;

    private final UserService userService;
    private final JwtIssuerService jwtIssuerService;
    private final UserDeletionService userDeletionService;

    public AuthService(UserService userService, JwtIssuerService jwtIssuerService, UserDeletionService userDeletionService) {
        this.userService = userService;
        this.jwtIssuerService = jwtIssuerService;
        this.userDeletionService = userDeletionService;
    }

    public record LoginResult(String accessToken, Long userId) {}

    public UserEntity register(String email, String password, String userName) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        return userService.register(email, password, userName);
    }

    /**
     * @throws AuthException with {@code INVALID_CREDENTIALS} for an unknown email or wrong password
     */
    public LoginResult login(String email, String password) {
        UserEntity user = userService.verifyCredentials(email, password)
                .orElseThrow(() -> {
                    log.info("Login rejected for {}", maskEmail(email));
                    return new AuthException(AuthException.Reason.INVALID_CREDENTIALS, "Incorrect email or password");
                });
        JwtIssuerService.IssuedToken token = jwtIssuerService.issue(user.getId(), user.getEmail());
        log.info("Issued token for user {} (expires {})", user.getId(), token.expiresAt());
        return new LoginResult(token.token(), user.getId());
    }

    public UserEntity profile(Identity identity) {
        return userService.findById(identity.id())
                .orElseThrow(() -> new AuthException(AuthException.Reason.UNKNOWN_SUBJECT, "Could not validate credentials"));
    }

    public void deleteAccount(Identity identity) {
        userDeletionService.deleteUser(identity.id());
    }

    static String maskEmail(String email) {
        if (email == null) {
            return "<none>";
        }
        int at = email.indexOf('@');
        return at <= 1 ? "***" + (at >= 0 ? email.substring(at) : "") : email.charAt(0) + "***" + email.substring(at);
    }
}
