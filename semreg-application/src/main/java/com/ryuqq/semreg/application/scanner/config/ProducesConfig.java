package com.ryuqq.semreg.application.scanner.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verb가 생성하는 엔티티 설정.
 *
 * @param type 생성되는 엔티티 유형
 * @param resolved 새로 만들지 않고 기존 엔티티를 해석하는지 여부
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record ProducesConfig(@JsonProperty("type") String type, boolean resolved) {
}
