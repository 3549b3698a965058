package com.ryuqq.semreg.application.scanner.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 인자 값을 엔티티로 해석하기 위한 조회 설정.
 *
 * <p>{@code search_key}는 단순 컬럼 이름, s-expression 문자열
 * ({@code "(search_name date_of_birth)"}) 또는 {@code primary} 필드를 가진 객체일 수 있습니다.</p>
 *
 * @param table 테이블
 * @param schema 스키마 (null 가능)
 * @param entityType 엔티티 유형 (null이면 table 사용)
 * @param searchKey 검색 키 설정
 * @param primaryKey 기본 키 컬럼
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record LookupConfig(
    String table,
    String schema,
    String entityType,
    @JsonAlias("code_column") JsonNode searchKey,
    @JsonAlias("id_column") String primaryKey
) {

    public LookupConfig {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table cannot be null or blank");
        }
    }

    /**
     * entityType이 없으면 table을 반환.
     *
     * @return 유효한 엔티티 유형 이름
     */
    public String effectiveEntityType() {
        return entityType == null || entityType.isBlank() ? table : entityType;
    }

    /**
     * 검색 키의 기본 컬럼.
     *
     * @return 기본 검색 컬럼 (설정이 없으면 null)
     */
    public String primarySearchColumn() {
        if (searchKey == null || searchKey.isNull()) {
            return null;
        }
        if (searchKey.isObject()) {
            JsonNode primary = searchKey.get("primary");
            return primary == null || primary.isNull() ? null : primary.asText();
        }
        String text = searchKey.asText().trim();
        if (text.startsWith("(")) {
            String inner = text.substring(1).trim();
            int end = 0;
            while (end < inner.length()
                && !Character.isWhitespace(inner.charAt(end))
                && inner.charAt(end) != '('
                && inner.charAt(end) != ')') {
                end++;
            }
            return inner.substring(0, end);
        }
        return text;
    }
}
