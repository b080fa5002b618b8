package com.dev.prostaff.service;

import com.dev.prostaff.domain.Organization;
import com.dev.prostaff.domain.Role;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AuthService")
class AuthServiceTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private UserRepository userRepository;
    private UserStore userStore;
    private OrganizationStore organizationStore;
    private SessionService sessionService;
    private AuthService authService;
    private User user;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        userStore = mock(UserStore.class);
        organizationStore = mock(OrganizationStore.class);
        sessionService = mock(SessionService.class);
        authService = new AuthService(userRepository, userStore, organizationStore, sessionService,
                passwordEncoder, Clock.fixed(NOW, ZoneOffset.UTC));
        user = User.builder()
                .id(UUID.randomUUID())
                .organization(Organization.builder().id(UUID.randomUUID()).name("paiN Gaming").region("BR").build())
                .email("coach@prostaff.gg")
                .fullName("Coach")
                .role(Role.COACH)
                .passwordDigest(passwordEncoder.encode("s3cret"))
                .createdAt(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC))
                .build();
    }

    @Test
    @DisplayName("issues a pair for valid credentials and records the login")
    void login() {
        TokenPair pair = TokenPair.bearer("access", "refresh", 86400);
        when(userRepository.findByEmailIgnoreCase("coach@prostaff.gg")).thenReturn(Optional.of(user));
        when(sessionService.issueTokenPair(any(UserRecord.class))).thenReturn(pair);

        assertThat(authService.login("coach@prostaff.gg", "s3cret")).isEqualTo(pair);

        ArgumentCaptor<UserRecord> issuedFor = ArgumentCaptor.forClass(UserRecord.class);
        verify(sessionService).issueTokenPair(issuedFor.capture());
        assertThat(issuedFor.getValue().organizationId()).isEqualTo(user.getOrganization().getId());
        assertThat(user.getLastLoginAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        verify(userRepository).save(user);
    }

    @Test
    @DisplayName("a wrong password fails like an unknown email")
    void badCredentials() {
        when(userRepository.findByEmailIgnoreCase("coach@prostaff.gg")).thenReturn(Optional.of(user));
        when(userRepository.findByEmailIgnoreCase("nobody@prostaff.gg")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login("coach@prostaff.gg", "wrong"))
                .isInstanceOf(BadCredentialsException.class);
        assertThatThrownBy(() -> authService.login("nobody@prostaff.gg", "s3cret"))
                .isInstanceOf(BadCredentialsException.class);
        verify(sessionService, never()).issueTokenPair(any());
    }

    @Test
    @DisplayName("logout revokes both presented tokens")
    void logout() {
        authService.logout("access", "refresh");

        verify(sessionService).revokeToken("access");
        verify(sessionService).revokeToken("refresh");
    }

    @Test
    @DisplayName("logout without refresh token revokes only the access token")
    void logoutWithoutRefresh() {
        authService.logout("access", null);

        verify(sessionService).revokeToken("access");
        verify(sessionService, never()).revokeToken(null);
    }

    @Test
    @DisplayName("profile includes the organization")
    void profile() {
        UUID orgId = user.getOrganization().getId();
        UserRecord record = UserRecord.from(user);
        when(userStore.findById(user.getId())).thenReturn(Optional.of(record));
        when(organizationStore.findById(orgId)).thenReturn(Optional.of(new OrganizationRecord(orgId, "paiN Gaming", "BR")));

        ProfileResponse profile = authService.profile(new Identity(user.getId(), orgId, Role.COACH));

        assertThat(profile.role()).isEqualTo("coach");
        assertThat(profile.organization().name()).isEqualTo("paiN Gaming");
    }

    @Test
    @DisplayName("profile of a vanished user is not found")
    void profileMissing() {
        when(userStore.findById(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.profile(new Identity(UUID.randomUUID(), UUID.randomUUID(), Role.VIEWER)))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
