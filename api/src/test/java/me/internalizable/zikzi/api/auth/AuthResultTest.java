package me.internalizable.zikzi.api.auth;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AuthResultTest {

    @Test
    void authenticatedResultCarriesUserAndMethod() {
        AuthResult result = AuthResult.authenticated("u1", AuthMethod.DIGEST);

        assertThat(result.isAuthenticated()).isTrue();
        assertThat(result.getUserId()).isEqualTo("u1");
        assertThat(result.getMethod()).isEqualTo(AuthMethod.DIGEST);
        assertThat(result).isEqualTo(AuthResult.authenticated("u1", AuthMethod.DIGEST));
    }

    @Test
    void unauthenticatedResultIsEmpty() {
        AuthResult result = AuthResult.unauthenticated();

        assertThat(result.isAuthenticated()).isFalse();
        assertThat(result.getUserId()).isNull();
        assertThat(result.getMethod()).isNull();
    }
}
