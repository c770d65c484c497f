package com.ctxlog.config.logging;

import com.ctxlog.logging.LogLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 구조화 로깅 설정 (app.logging.*)
 * 기동 시 한 번만 바인딩되며 런타임 재설정은 지원하지 않음
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.logging")
public class StructuredLoggingProperties {

    private LogFormat format = LogFormat.JSON;

    /** 이 레벨 미만의 레코드는 폐기 */
    private LogLevel level = LogLevel.INFO;

    private LogDestination destination = LogDestination.SLF4J;
}
