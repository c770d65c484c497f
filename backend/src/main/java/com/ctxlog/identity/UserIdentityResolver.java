package com.ctxlog.identity;

import com.ctxlog.config.identity.IdentityProperties;
import com.ctxlog.logging.LogEvent;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * 요청 헤더에서 사용자명 추출
 *
 * 우선순위 (먼저 일치하는 것 사용)
 * 1. 커스텀 헤더 (기본 X-User-Name) 값 그대로
 * 2. Authorization: Basic - 사용자명만 사용, 비밀번호는 검증하지 않음 (MOCK)
 * 3. Authorization: Bearer - MockBearerTokenDecoder 규칙
 * 4. 모두 불일치 → Optional.empty() (익명)
 *
 * 형식이 깨진 헤더는 예외 없이 불일치로 처리
 */
@Slf4j
@Component
public class UserIdentityResolver {

    private static final String BASIC_PREFIX = "Basic ";
    private static final String BEARER_PREFIX = "Bearer ";

    private final String userHeader;

    @Autowired
    public UserIdentityResolver(IdentityProperties properties) {
        this(properties.getUserHeader());
    }

    public UserIdentityResolver(String userHeader) {
        this.userHeader = userHeader;
    }

    public Optional<String> resolve(HttpServletRequest request) {
        // 서블릿 컨테이너의 getHeader 는 헤더 이름 대소문자를 구분하지 않음
        return resolve(
                request.getHeader(userHeader),
                request.getHeader(HttpHeaders.AUTHORIZATION)
        );
    }

    public Optional<String> resolve(String userHeaderValue, String authorization) {
        if (userHeaderValue != null && !userHeaderValue.isEmpty()) {
            return Optional.of(userHeaderValue);
        }

        if (authorization == null) {
            return Optional.empty();
        }

        if (hasScheme(authorization, BASIC_PREFIX)) {
            return fromBasic(authorization.substring(BASIC_PREFIX.length()));
        }

        if (hasScheme(authorization, BEARER_PREFIX)) {
            return MockBearerTokenDecoder.decode(authorization.substring(BEARER_PREFIX.length()));
        }

        return Optional.empty();
    }

    private Optional<String> fromBasic(String encoded) {
        String decoded;
        try {
            byte[] raw = Base64.getDecoder().decode(encoded.trim());
            decoded = StandardCharsets.UTF_8.newDecoder()
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (IllegalArgumentException | CharacterCodingException e) {
            log.warn("event={} reason={}", LogEvent.INVALID_BASIC_AUTH, e.getClass().getSimpleName());
            return Optional.empty();
        }

        int separator = decoded.indexOf(':');
        if (separator < 0) {
            log.warn("event={} reason=MISSING_SEPARATOR", LogEvent.INVALID_BASIC_AUTH);
            return Optional.empty();
        }

        String username = decoded.substring(0, separator);
        return username.isEmpty() ? Optional.empty() : Optional.of(username);
    }

    // 인증 스킴 키워드는 대소문자 구분 없이 비교
    private static boolean hasScheme(String authorization, String prefix) {
        return authorization.regionMatches(true, 0, prefix, 0, prefix.length());
    }
}
