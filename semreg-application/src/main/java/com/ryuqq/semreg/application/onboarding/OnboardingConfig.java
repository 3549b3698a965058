package com.ryuqq.semreg.application.onboarding;

/**
 * 온보딩 파이프라인 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>setLabelPrefix: 스냅샷 세트 라벨 접두사 (기본 "onboarding:", 뒤에 엔티티 FQN)</li>
 *   <li>driftRationale: 드리프트 갱신 변경 사유 (기본 "Onboarding pipeline drift update")</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 * @param setLabelPrefix 스냅샷 세트 라벨 접두사
 * @param driftRationale 드리프트 변경 사유 (blank 불가)
 */
public record OnboardingConfig(String setLabelPrefix, String driftRationale) {

    public static final String DEFAULT_SET_LABEL_PREFIX = "onboarding:";
    public static final String DEFAULT_DRIFT_RATIONALE = "Onboarding pipeline drift update";

    /**
     * 기본 설정 생성자.
     */
    public OnboardingConfig() {
        this(DEFAULT_SET_LABEL_PREFIX, DEFAULT_DRIFT_RATIONALE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OnboardingConfig {
        if (setLabelPrefix == null) {
            throw new IllegalArgumentException("setLabelPrefix cannot be null");
        }
        if (driftRationale == null || driftRationale.isBlank()) {
            throw new IllegalArgumentException("driftRationale cannot be null or blank");
        }
    }

    /**
     * 엔티티 유형의 스냅샷 세트 라벨.
     *
     * @param entityFqn 엔티티 유형 FQN
     * @return 라벨
     */
    public String setLabelFor(String entityFqn) {
        return setLabelPrefix + entityFqn;
    }

    public OnboardingConfig withSetLabelPrefix(String setLabelPrefix) {
        return new OnboardingConfig(setLabelPrefix, this.driftRationale);
    }

    public OnboardingConfig withDriftRationale(String driftRationale) {
        return new OnboardingConfig(this.setLabelPrefix, driftRationale);
    }
}
