package com.ryuqq.semreg.application.scanner.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verb 반환 설정.
 *
 * @param type 반환 타입 (예: "uuid", "record", "affected")
 * @param name 결과 바인딩 이름 (null 가능)
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record ReturnsConfig(@JsonProperty("type") String type, String name) {
}
