package com.ryuqq.semreg.application.scanner.label;

import java.util.List;

/**
 * 정의 하나에 제안된 보안 라벨.
 *
 * @param classification 데이터 등급
 * @param pii 개인정보 포함 여부
 * @param jurisdictions 적용 관할 (없으면 빈 목록)
 * @param purposeLimitation 허용 사용 목적 (없으면 빈 목록)
 * @param handlingControls 취급 통제
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record SecurityLabel(
    Classification classification,
    boolean pii,
    List<String> jurisdictions,
    List<String> purposeLimitation,
    List<HandlingControl> handlingControls
) {

    private static final SecurityLabel DEFAULT =
        new SecurityLabel(Classification.INTERNAL, false, List.of(), List.of(), List.of());

    public SecurityLabel {
        if (classification == null) {
            throw new IllegalArgumentException("classification cannot be null");
        }
        jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
        purposeLimitation = purposeLimitation == null ? List.of() : List.copyOf(purposeLimitation);
        handlingControls = handlingControls == null ? List.of() : List.copyOf(handlingControls);
    }

    /**
     * 아무 규칙에도 걸리지 않은 정의의 라벨.
     *
     * @return INTERNAL, 개인정보 없음, 통제 없음
     */
    public static SecurityLabel defaultLabel() {
        return DEFAULT;
    }

    /**
     * 취급 통제 포함 여부.
     *
     * @param control 확인할 통제
     * @return 포함하면 true
     */
    public boolean requires(HandlingControl control) {
        return handlingControls.contains(control);
    }
}
