package com.ktb.realtimechat.service;

import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

/**
 * 액세스 토큰 검증.
 *
 * 서명/만료는 JwtDecoder 가 검사하고, 여기서는 access 토큰 여부와 subject 를 확인한다.
 */
@Service
@RequiredArgsConstructor
public class JwtService {

    private static final String CLAIM_TYPE = "type";
    private static final String ACCESS_TOKEN_TYPE = "access";

    private final JwtDecoder jwtDecoder;

    /**
     * @return 토큰 subject (userId)
     * @throws JwtException 서명, 만료, 타입, subject 중 하나라도 유효하지 않으면
     */
    public String extractUserId(String token) {
        Jwt jwt = jwtDecoder.decode(token);

        if (!ACCESS_TOKEN_TYPE.equals(jwt.getClaimAsString(CLAIM_TYPE))) {
            throw new BadJwtException("Not an access token");
        }
        if (jwt.getExpiresAt() == null) {
            throw new BadJwtException("Token has no expiration");
        }
        String subject = jwt.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new BadJwtException("Token has no subject");
        }
        return subject;
    }
}
