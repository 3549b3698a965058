package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.semreg.core.model.ObjectType;

import java.util.List;

/**
 * Verb(연산) 계약 정의.
 *
 * @param fqn 정규화된 이름 ("domain.action")
 * @param domain 도메인
 * @param action 동작 이름
 * @param description 설명
 * @param behavior 실행 방식 (예: "crud", "plugin")
 * @param args 인자 목록
 * @param returns 반환 명세 (null 가능)
 * @param preconditions 사전 조건
 * @param postconditions 사후 조건
 * @param produces 생성하는 엔티티 (null 가능)
 * @param consumes 소비하는 엔티티 유형 목록
 * @param invocationPhrases 호출 문구
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record VerbContractBody(
    String fqn,
    String domain,
    String action,
    String description,
    String behavior,
    List<VerbArgDef> args,
    VerbReturnSpec returns,
    List<VerbPrecondition> preconditions,
    List<String> postconditions,
    VerbProducesSpec produces,
    List<String> consumes,
    List<String> invocationPhrases
) implements Definition {

    public VerbContractBody {
        args = args == null ? List.of() : List.copyOf(args);
        preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
        postconditions = postconditions == null ? List.of() : List.copyOf(postconditions);
        consumes = consumes == null ? List.of() : List.copyOf(consumes);
        invocationPhrases = invocationPhrases == null ? List.of() : List.copyOf(invocationPhrases);
    }

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.VERB_CONTRACT;
    }

    /**
     * Verb 인자 정의.
     *
     * @param name 인자 이름
     * @param argType 인자 타입 (소문자)
     * @param required 필수 여부
     * @param description 설명 (null 가능)
     * @param lookup 엔티티 조회 설정 (null 가능)
     * @param validValues 허용 값 (null 가능)
     * @param defaultValue 기본값 (null 가능)
     */
    public record VerbArgDef(
        String name,
        String argType,
        boolean required,
        String description,
        VerbArgLookup lookup,
        List<String> validValues,
        String defaultValue
    ) {
    }

    /**
     * 인자 값을 엔티티로 해석하기 위한 조회 설정.
     *
     * @param table 테이블
     * @param entityType 엔티티 유형
     * @param schema 스키마 (null 가능)
     * @param searchKey 검색 키 컬럼 (null 가능)
     * @param primaryKey 기본 키 컬럼 (null 가능)
     */
    public record VerbArgLookup(String table, String entityType, String schema, String searchKey, String primaryKey) {
    }

    /**
     * 반환 명세.
     *
     * @param returnType 반환 타입 (소문자)
     * @param schema 스키마 (null 가능)
     */
    public record VerbReturnSpec(String returnType, String schema) {
    }

    /**
     * 사전 조건.
     *
     * @param kind 조건 종류 ("requires_state", "precondition_check")
     * @param value 조건 값
     * @param description 설명 (null 가능)
     */
    public record VerbPrecondition(String kind, String value, String description) {
    }

    /**
     * 생성 명세.
     *
     * @param entityType 생성되는 엔티티 유형
     * @param resolved 생성 즉시 해석되는지 여부
     */
    public record VerbProducesSpec(String entityType, boolean resolved) {
    }
}
