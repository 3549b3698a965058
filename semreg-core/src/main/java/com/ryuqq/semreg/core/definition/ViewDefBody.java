package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.semreg.core.model.ObjectType;

import java.util.ArrayList;
import java.util.List;

/**
 * 뷰 정의.
 *
 * @param fqn 정규화된 이름
 * @param name 표시 이름
 * @param description 설명
 * @param domain 도메인
 * @param baseEntityType 기준 엔티티 유형 FQN
 * @param columns 컬럼 목록
 * @param filters 필터 목록
 * @param sortOrder 정렬 순서
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record ViewDefBody(
    String fqn,
    String name,
    String description,
    String domain,
    String baseEntityType,
    List<ViewColumn> columns,
    List<ViewFilter> filters,
    List<ViewSortField> sortOrder
) implements Definition {

    public ViewDefBody {
        columns = columns == null ? List.of() : List.copyOf(columns);
        filters = filters == null ? List.of() : List.copyOf(filters);
        sortOrder = sortOrder == null ? List.of() : List.copyOf(sortOrder);
    }

    /**
     * 해당 속성 FQN의 컬럼이 이미 있는지 확인.
     *
     * @param attributeFqn 속성 FQN
     * @return 존재하면 true
     */
    public boolean containsColumn(String attributeFqn) {
        return columns.stream().anyMatch(column -> column.attributeFqn().equals(attributeFqn));
    }

    /**
     * 아직 없는 컬럼만 뒤에 덧붙인 사본.
     *
     * <p>추가할 컬럼이 하나도 없으면 {@code this}를 그대로 반환하므로
     * 호출자는 참조 비교로 변경 여부를 판단할 수 있습니다.</p>
     *
     * @param additions 추가 후보 컬럼
     * @return 병합된 ViewDefBody (변경이 없으면 this)
     */
    public ViewDefBody mergeColumns(List<ViewColumn> additions) {
        List<ViewColumn> merged = new ArrayList<>(columns);
        boolean changed = false;
        for (ViewColumn column : additions) {
            boolean present = merged.stream()
                .anyMatch(existing -> existing.attributeFqn().equals(column.attributeFqn()));
            if (!present) {
                merged.add(column);
                changed = true;
            }
        }
        if (!changed) {
            return this;
        }
        return new ViewDefBody(fqn, name, description, domain, baseEntityType, merged, filters, sortOrder);
    }

    @JsonIgnore
    @Override
    public ObjectType objectType() {
        return ObjectType.VIEW_DEF;
    }

    /**
     * 뷰 필터.
     *
     * @param attributeFqn 속성 FQN
     * @param operator 연산자
     * @param value 비교 값
     */
    public record ViewFilter(String attributeFqn, String operator, String value) {
    }

    /**
     * 정렬 필드.
     *
     * @param attributeFqn 속성 FQN
     * @param direction "asc" 또는 "desc"
     */
    public record ViewSortField(String attributeFqn, String direction) {
    }
}
