package com.dev.prostaff.service;

import com.dev.prostaff.domain.User;
import com.dev.prostaff.repository.UserRepository;
import com.dev.prostaff.security.Identity;
import com.dev.prostaff.security.SessionService;
import com.dev.prostaff.security.TokenPair;
import com.dev.prostaff.store.OrganizationRecord;
import com.dev.prostaff.store.OrganizationStore;
import com.dev.prostaff.store.UserRecord;
import com.dev.prostaff.store.UserStore;
import com.dev.prostaff.web.ResourceNotFoundException;
import com.dev.prostaff.web.dto.ProfileResponse;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

@Slf4j
@Service
public class AuthService {

    private final UserRepository userRepository;
    private final UserStore userStore;
    private final OrganizationStore organizationStore;
    private final SessionService sessionService;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public AuthService(UserRepository userRepository,
                       UserStore userStore,
                       OrganizationStore organizationStore,
                       SessionService sessionService,
                       PasswordEncoder passwordEncoder,
                       Clock clock) {
        this.userRepository = userRepository;
        this.userStore = userStore;
        this.organizationStore = organizationStore;
        this.sessionService = sessionService;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Transactional
    public TokenPair login(String email, String password) {
        User user = userRepository.findByEmailIgnoreCase(email.strip())
                .filter(candidate -> passwordEncoder.matches(password, candidate.getPasswordDigest()))
                .orElseThrow(() -> {
                    log.warn("Failed login attempt");
                    return new BadCredentialsException("Invalid email or password");
                });
        user.setLastLoginAt(OffsetDateTime.now(clock));
        userRepository.save(user);
        log.info("User {} logged in", user.getId());
        return sessionService.issueTokenPair(UserRecord.from(user));
    }

    public TokenPair refresh(String refreshToken) {
        return sessionService.refresh(refreshToken);
    }

    public void logout(String accessToken, String refreshToken) {
        sessionService.revokeToken(accessToken);
        if (refreshToken != null && !refreshToken.isBlank()) {
            sessionService.revokeToken(refreshToken);
        }
    }

    public ProfileResponse profile(Identity identity) {
        UserRecord user = userStore.findById(identity.userId())
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
        OrganizationRecord organization = user.hasOrganization()
                ? organizationStore.findById(user.organizationId()).orElse(null)
                : null;
        return ProfileResponse.of(user, organization);
    }
}
