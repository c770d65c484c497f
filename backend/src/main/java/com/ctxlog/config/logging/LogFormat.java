package com.ctxlog.config.logging;

public enum LogFormat {

    /** 기계 파싱용 JSON 한 줄 */
    JSON,

    /** key=value 텍스트 */
    KEY_VALUE
}
