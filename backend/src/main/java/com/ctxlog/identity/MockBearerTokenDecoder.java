package com.ctxlog.identity;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 데모용 Bearer 토큰 해석기 (MOCK)
 *
 * <p>서명 검증도, 만료 확인도 하지 않는다. 실제 인증 수단으로 사용 금지.
 * 토큰 문자열 안의 {@code user_<이름>_...} 또는 {@code user_<이름>} 패턴에서 이름만 꺼낸다.
 * 패턴이 없으면 신원 없음.
 */
public final class MockBearerTokenDecoder {

    private static final Pattern USER_PATTERN =
            Pattern.compile("user_(\\w+?)(?:_|$)", Pattern.UNICODE_CHARACTER_CLASS);

    private MockBearerTokenDecoder() {
    }

    public static Optional<String> decode(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }

        Matcher matcher = USER_PATTERN.matcher(token);
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }
}
