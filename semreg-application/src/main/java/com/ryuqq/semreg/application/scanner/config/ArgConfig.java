package com.ryuqq.semreg.application.scanner.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Verb 인자 설정.
 *
 * @param name 인자 이름
 * @param type 인자 타입 (예: "string", "uuid", "string_list")
 * @param required 필수 여부
 * @param mapsTo 매핑되는 물리 컬럼 (null 가능)
 * @param lookup 엔티티 조회 설정 (null 가능)
 * @param validValues 허용 값 (null 가능)
 * @param defaultValue 기본값 (null 가능, 임의의 YAML 값)
 * @param description 설명 (null 가능)
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record ArgConfig(
    String name,
    @JsonProperty("type") String type,
    boolean required,
    String mapsTo,
    LookupConfig lookup,
    List<String> validValues,
    @JsonProperty("default") JsonNode defaultValue,
    String description
) {

    public ArgConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        validValues = validValues == null ? null : List.copyOf(validValues);
    }

    /**
     * 허용 값 목록이 선언되었는지 여부 (빈 목록 포함).
     *
     * @return 선언되었으면 true
     */
    public boolean declaresValidValues() {
        return validValues != null;
    }
}
