package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.semreg.core.model.ObjectType;

import java.util.ArrayList;
import java.util.List;

/**
 * 엔티티 유형 정의.
 *
 * @param fqn 정규화된 이름 (예: "entity.test-widget")
 * @param name 표시 이름
 * @param description 설명
 * @param domain 업무 도메인
 * @param dbTable 물리 테이블 매핑 (null 가능)
 * @param lifecycleStates 생명주기 상태 목록
 * @param requiredAttributes 필수 속성 FQN 목록
 * @param optionalAttributes 선택 속성 FQN 목록
 * @param parentType 상위 엔티티 유형 FQN (null 가능)
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record EntityTypeDefBody(
    String fqn,
    String name,
    String description,
    String domain,
    DbTableMapping dbTable,
    List<String> lifecycleStates,
    List<String> requiredAttributes,
    List<String> optionalAttributes,
    String parentType
) implements Definition {

    public EntityTypeDefBody {
        lifecycleStates = lifecycleStates == null ? List.of() : List.copyOf(lifecycleStates);
        requiredAttributes = requiredAttributes == null ? List.of() : List.copyOf(requiredAttributes);
        optionalAttributes = optionalAttributes == null ? List.of() : List.copyOf(optionalAttributes);
    }

    /**
     * 테이블 매핑과 속성 목록 없이 엔티티 유형 생성.
     *
     * @param fqn FQN
     * @param name 표시 이름
     * @param description 설명
     * @param domain 도메인
     * @return EntityTypeDefBody
     */
    public static EntityTypeDefBody of(String fqn, String name, String description, String domain) {
        return new EntityTypeDefBody(fqn, name, description, domain, null, null, null, null, null);
    }

    /**
     * 필수/선택 속성 목록만 바꾼 사본.
     *
     * @param required 필수 속성 FQN
     * @param optional 선택 속성 FQN
     * @return 새 EntityTypeDefBody
     */
    public EntityTypeDefBody withAttributes(List<String> required, List<String> optional) {
        return new EntityTypeDefBody(
            fqn, name, description, domain, dbTable, lifecycleStates, required, optional, parentType
        );
    }

    /**
     * 필수 속성 다음 선택 속성 순서로 선언된 모든 속성 FQN.
     *
     * @return 속성 FQN 목록
     */
    public List<String> declaredAttributes() {
        List<String> all = new ArrayList<>(requiredAttributes);
        all.addAll(optionalAttributes);
        return List.copyOf(all);
    }

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.ENTITY_TYPE_DEF;
    }

    /**
     * 엔티티 유형의 물리 테이블 매핑.
     *
     * @param schema 스키마
     * @param table 테이블
     * @param primaryKey 기본 키 컬럼
     * @param nameColumn 이름 컬럼 (null 가능)
     */
    public record DbTableMapping(String schema, String table, String primaryKey, String nameColumn) {
    }
}
