package com.ktb.realtimechat.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ktb.realtimechat.exception.AuthenticationFailureException;
import com.ktb.realtimechat.model.User;
import com.ktb.realtimechat.repository.UserRepository;
import com.ktb.realtimechat.service.JwtService;
import java.net.URI;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.security.oauth2.jwt.BadJwtException;

class SocketAuthenticatorTest {

    private final JwtService jwtService = mock(JwtService.class);
    private final UserRepository userRepository = mock(UserRepository.class);
    private final SocketAuthenticator authenticator = new SocketAuthenticator(jwtService, userRepository);

    @Test
    void resolvesActiveUser() {
        when(jwtService.extractUserId("t")).thenReturn("u1");
        when(userRepository.findById("u1")).thenReturn(Optional.of(
                User.builder().id("u1").username("alice").displayName("Alice").build()));

        SocketUser user = authenticator.authenticate("t");

        assertThat(user).isEqualTo(new SocketUser("u1", "alice", "Alice"));
    }

    @Test
    void missingTokenFails() {
        assertThatThrownBy(() -> authenticator.authenticate(null)).isInstanceOf(AuthenticationFailureException.class);
        assertThatThrownBy(() -> authenticator.authenticate(" ")).isInstanceOf(AuthenticationFailureException.class);
    }

    @Test
    void invalidTokenFails() {
        when(jwtService.extractUserId("t")).thenThrow(new BadJwtException("bad signature"));

        assertThatThrownBy(() -> authenticator.authenticate("t"))
                .isInstanceOf(AuthenticationFailureException.class)
                .hasFieldOrPropertyWithValue("code", "AUTH_FAILED");
    }

    @Test
    void unknownOrInactiveUserFails() {
        when(jwtService.extractUserId("t1")).thenReturn("ghost");
        when(userRepository.findById("ghost")).thenReturn(Optional.empty());
        when(jwtService.extractUserId("t2")).thenReturn("u2");
        when(userRepository.findById("u2")).thenReturn(Optional.of(
                User.builder().id("u2").username("bob").active(false).build()));

        assertThatThrownBy(() -> authenticator.authenticate("t1")).isInstanceOf(AuthenticationFailureException.class);
        assertThatThrownBy(() -> authenticator.authenticate("t2")).isInstanceOf(AuthenticationFailureException.class);
    }

    @Test
    void storeFailureIsNotAnAuthenticationFailure() {
        when(jwtService.extractUserId("t")).thenReturn("u1");
        when(userRepository.findById("u1")).thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatThrownBy(() -> authenticator.authenticate("t"))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void extractsTokenFromQuery() {
        assertThat(SocketAuthenticator.extractToken(URI.create("ws://localhost/ws?foo=1&token=abc.def"))).isEqualTo("abc.def");
        assertThat(SocketAuthenticator.extractToken(URI.create("ws://localhost/ws"))).isNull();
        assertThat(SocketAuthenticator.extractToken(null)).isNull();
    }
}
