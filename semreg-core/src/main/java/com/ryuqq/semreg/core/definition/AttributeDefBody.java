package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.semreg.core.model.ObjectType;

import java.util.List;

/**
 * 속성 정의.
 *
 * @param fqn 정규화된 이름 (예: "cbu.jurisdiction")
 * @param name 표시 이름
 * @param description 설명
 * @param domain 업무 도메인
 * @param dataType 데이터 타입
 * @param validValues 허용 값 ({@link AttributeDataType#ENUM}일 때 사용)
 * @param source 값의 출처 (null 가능)
 * @param required 필수 여부
 * @param sinks 값이 흘러가는 대상 목록
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record AttributeDefBody(
    String fqn,
    String name,
    String description,
    String domain,
    AttributeDataType dataType,
    List<String> validValues,
    AttributeSource source,
    boolean required,
    List<String> sinks
) implements Definition {

    public AttributeDefBody {
        dataType = dataType == null ? AttributeDataType.STRING : dataType;
        validValues = validValues == null ? List.of() : List.copyOf(validValues);
        sinks = sinks == null ? List.of() : List.copyOf(sinks);
    }

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.ATTRIBUTE_DEF;
    }

    /**
     * 속성 값의 출처.
     *
     * @param producingVerb 값을 생성하는 verb FQN (null 가능)
     * @param table 물리 테이블 (null 가능)
     * @param column 물리 컬럼 (null 가능)
     * @param derived 파생 속성 여부
     */
    public record AttributeSource(String producingVerb, String table, String column, boolean derived) {
    }
}
