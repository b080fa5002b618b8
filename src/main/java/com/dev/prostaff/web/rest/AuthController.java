package com.dev.prostaff.web.rest;

import com.dev.prostaff.security.BearerTokenExtractor;
import com.dev.prostaff.security.Identity;
import com.dev.prostaff.security.TokenPair;
import com.dev.prostaff.service.AuthService;
import com.dev.prostaff.web.dto.LoginRequest;
import com.dev.prostaff.web.dto.LogoutRequest;
import com.dev.prostaff.web.dto.ProfileResponse;
import com.dev.prostaff.web.dto.RefreshRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/login")
    public TokenPair login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request.email(), request.password());
    }

    @PostMapping("/refresh")
    public TokenPair refresh(@Valid @RequestBody RefreshRequest request) {
        return authService.refresh(request.refreshToken());
    }

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
                       @RequestBody(required = false) LogoutRequest request) {
        String accessToken = BearerTokenExtractor.extract(authorization).orElse(null);
        authService.logout(accessToken, request != null ? request.refreshToken() : null);
    }

    @GetMapping("/me")
    public ProfileResponse me(@AuthenticationPrincipal Identity identity) {
        return authService.profile(identity);
    }
}
