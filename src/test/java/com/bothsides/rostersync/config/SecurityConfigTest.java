package com.bothsides.rostersync.config;

import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SecurityConfigTest {

    private final SecurityConfig securityConfig = new SecurityConfig();

    @Test
    void shouldMapRolesClaimToRoleAuthorities() {
        Jwt jwt = jwt(List.of("admin", "integration"));

        AbstractAuthenticationToken token = securityConfig.jwtAuthenticationConverter().convert(jwt).block();

        assertThat(token).isNotNull();
        assertThat(token.getName()).isEqualTo("sis-connector");
        assertThat(token.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("ROLE_ADMIN", "ROLE_INTEGRATION");
    }

    @Test
    void shouldGrantNothingWithoutRolesClaim() {
        Jwt jwt = Jwt.withTokenValue("token")
                .header("alg", "RS256")
                .subject("sis-connector")
                .claim("scope", "sync:read")
                .issuedAt(Instant.parse("2026-03-02T09:00:00Z"))
                .expiresAt(Instant.parse("2026-03-02T10:00:00Z"))
                .build();

        assertThat(SecurityConfig.rolesAuthoritiesConverter().convert(jwt)).isEmpty();
    }

    private static Jwt jwt(List<String> roles) {
        return Jwt.withTokenValue("token")
                .header("alg", "RS256")
                .subject("sis-connector")
                .claim(SecurityConfig.ROLES_CLAIM, roles)
                .issuedAt(Instant.parse("2026-03-02T09:00:00Z"))
                .expiresAt(Instant.parse("2026-03-02T10:00:00Z"))
                .build();
    }
}
