package com.ctxlog.config.identity;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.identity")
public class IdentityProperties {

    /** 사용자명을 그대로 전달하는 커스텀 헤더 이름 */
    private String userHeader = "X-User-Name";
}
