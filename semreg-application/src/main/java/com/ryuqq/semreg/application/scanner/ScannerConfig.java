package com.ryuqq.semreg.application.scanner;

/**
 * 스캐너 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>setLabel: 스캔마다 생성하는 스냅샷 세트 라벨 (기본 "onboarding-scan")</li>
 *   <li>createdBy: 생성 주체 (기본 "scanner")</li>
 *   <li>driftRationale: 드리프트 갱신 변경 사유 (기본 "Scanner drift update")</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 * @param setLabel 스냅샷 세트 라벨 (null 가능)
 * @param createdBy 생성 주체 (blank 불가)
 * @param driftRationale 드리프트 변경 사유 (blank 불가)
 */
public record ScannerConfig(String setLabel, String createdBy, String driftRationale) {

    public static final String DEFAULT_SET_LABEL = "onboarding-scan";
    public static final String DEFAULT_CREATED_BY = "scanner";
    public static final String DEFAULT_DRIFT_RATIONALE = "Scanner drift update";

    /**
     * 기본 설정 생성자.
     */
    public ScannerConfig() {
        this(DEFAULT_SET_LABEL, DEFAULT_CREATED_BY, DEFAULT_DRIFT_RATIONALE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException createdBy 또는 driftRationale이 blank인 경우
     */
    public ScannerConfig {
        if (createdBy == null || createdBy.isBlank()) {
            throw new IllegalArgumentException("createdBy cannot be null or blank");
        }
        if (driftRationale == null || driftRationale.isBlank()) {
            throw new IllegalArgumentException("driftRationale cannot be null or blank");
        }
    }

    public ScannerConfig withSetLabel(String setLabel) {
        return new ScannerConfig(setLabel, this.createdBy, this.driftRationale);
    }

    public ScannerConfig withCreatedBy(String createdBy) {
        return new ScannerConfig(this.setLabel, createdBy, this.driftRationale);
    }

    public ScannerConfig withDriftRationale(String driftRationale) {
        return new ScannerConfig(this.setLabel, this.createdBy, driftRationale);
    }
}
