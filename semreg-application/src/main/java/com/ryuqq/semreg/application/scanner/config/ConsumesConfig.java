package com.ryuqq.semreg.application.scanner.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verb가 소비하는 바인딩 설정.
 *
 * @param arg 참조를 담는 인자 이름
 * @param type 기대하는 바인딩 유형
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record ConsumesConfig(String arg, @JsonProperty("type") String type) {
}
