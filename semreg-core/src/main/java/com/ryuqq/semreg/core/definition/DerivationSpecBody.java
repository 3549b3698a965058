package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.semreg.core.model.ObjectType;

import java.util.List;

/**
 * 파생 속성 명세.
 *
 * @param fqn 정규화된 이름
 * @param name 표시 이름
 * @param description 설명
 * @param outputAttributeFqn 결과 속성 FQN
 * @param inputAttributeFqns 입력 속성 FQN 목록
 * @param expression 파생 표현식
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record DerivationSpecBody(
    String fqn,
    String name,
    String description,
    String outputAttributeFqn,
    List<String> inputAttributeFqns,
    String expression
) implements Definition {

    public DerivationSpecBody {
        inputAttributeFqns = inputAttributeFqns == null ? List.of() : List.copyOf(inputAttributeFqns);
    }

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.DERIVATION_SPEC;
    }
}
