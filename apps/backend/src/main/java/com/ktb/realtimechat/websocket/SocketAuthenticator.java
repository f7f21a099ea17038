package com.ktb.realtimechat.websocket;

import com.ktb.realtimechat.exception.AuthenticationFailureException;
import com.ktb.realtimechat.model.User;
import com.ktb.realtimechat.repository.UserRepository;
import com.ktb.realtimechat.service.JwtService;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * WebSocket 접속 인증.
 * 핸드셰이크 URI 의 token 쿼리 파라미터를 검증하고 사용자 정보를 조회한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketAuthenticator {

    static final String TOKEN_PARAM = "token";

    private final JwtService jwtService;
    private final UserRepository userRepository;

    /**
     * @throws AuthenticationFailureException 토큰이 없거나 유효하지 않거나, 사용자가 없거나 비활성이면
     */
    public SocketUser authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationFailureException("Missing token");
        }

        String userId;
        try {
            userId = jwtService.extractUserId(token);
        } catch (JwtException e) {
            log.debug("Token rejected - reason: {}", e.getMessage());
            throw new AuthenticationFailureException("Invalid token", e);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new AuthenticationFailureException("User not found"));
        if (!user.isActive()) {
            throw new AuthenticationFailureException("User is inactive");
        }
        return new SocketUser(user.getId(), user.getUsername(), user.getDisplayName());
    }

    public static String extractToken(URI uri) {
        if (uri == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(uri)
                .build()
                .getQueryParams()
                .getFirst(TOKEN_PARAM);
    }
}
