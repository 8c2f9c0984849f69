package com.alari.companion.auth;

import com.alari.companion.controller.dto.LoginRequestDto;
import com.alari.companion.controller.dto.RegisterRequestDto;
import com.alari.companion.controller.dto.TokenResponseDto;
import com.alari.companion.controller.dto.UserResponseDto;
import com.alari.companion.security.IdentityGate;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final IdentityGate identityGate;

    public AuthController(AuthService authService, IdentityGate identityGate) {
        this.authService = authService;
        this.identityGate = identityGate;
    }

    @PostMapping(path = "/register", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UserResponseDto> register(@Valid @RequestBody RegisterRequestDto request) {
        var user = authService.register(request.email(), request.password(), request.userName());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponseDto.from(user));
    }

    /** OAuth2 password-form style login: {@code username} carries the email. */
    @PostMapping(path = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public TokenResponseDto loginForm(@RequestParam("username") String username, @RequestParam("password") String password) {
        return token(authService.login(username, password));
    }

    @PostMapping(path = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TokenResponseDto loginJson(@Valid @RequestBody LoginRequestDto request) {
        return token(authService.login(request.email(), request.password()));
    }

    @GetMapping("/me")
    public UserResponseDto me() {
        return UserResponseDto.from(authService.profile(identityGate.authenticate()));
    }

    @DeleteMapping("/me")
    public ResponseEntity<Void> deleteMe() {
        authService.deleteAccount(identityGate.authenticate());
        return ResponseEntity.noContent().build();
    }

    private static TokenResponseDto token(AuthService.LoginResult result) {
        return TokenResponseDto.bearer(result.accessToken(), result.userId());
    }
}
