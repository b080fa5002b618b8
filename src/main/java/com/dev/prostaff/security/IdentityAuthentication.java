package com.dev.prostaff.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.Set;

public class IdentityAuthentication extends AbstractAuthenticationToken {

    private final Identity principal;
    private final String credentials;

    public IdentityAuthentication(Identity principal, String token) {
        super(Set.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name())));
        this.principal = principal;
        this.credentials = token;
        setAuthenticated(true);
    }

    @Override
    public Identity getPrincipal() {
        return principal;
    }

    @Override
    public String getCredentials() {
        return credentials;
    }

    @Override
    public String getName() {
        return principal.userId().toString();
    }
}
