package com.ryuqq.semreg.application.onboarding;

import com.ryuqq.semreg.core.model.SnapshotSetId;
import com.ryuqq.semreg.core.step.StepResult;

import java.util.ArrayList;
import java.util.List;

/**
 * 온보딩 파이프라인 실행 결과.
 *
 * <p>단계별 {@link StepResult}와 스냅샷 세트 ID를 담습니다.
 * 항목 단위 오류가 있어도 결과는 정상 반환되며, {@link #hasErrors()}로 확인합니다.</p>
 *
 * @param entityTypeStep 1단계: 엔티티 유형
 * @param attributesStep 2단계: 속성
 * @param verbContractsStep 3단계: verb 계약
 * @param taxonomyStep 4단계: 분류 체계 배치
 * @param viewsStep 5단계: 뷰 컬럼 병합
 * @param evidenceStep 6단계: 증빙 요구사항
 * @param snapshotSetId 스냅샷 세트 ID (dry run이면 null)
 * @param dryRun dry run 여부
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record OnboardingResult(
    StepResult entityTypeStep,
    StepResult attributesStep,
    StepResult verbContractsStep,
    StepResult taxonomyStep,
    StepResult viewsStep,
    StepResult evidenceStep,
    SnapshotSetId snapshotSetId,
    boolean dryRun
) {

    public OnboardingResult {
        entityTypeStep = entityTypeStep == null ? StepResult.empty() : entityTypeStep;
        attributesStep = attributesStep == null ? StepResult.empty() : attributesStep;
        verbContractsStep = verbContractsStep == null ? StepResult.empty() : verbContractsStep;
        taxonomyStep = taxonomyStep == null ? StepResult.empty() : taxonomyStep;
        viewsStep = viewsStep == null ? StepResult.empty() : viewsStep;
        evidenceStep = evidenceStep == null ? StepResult.empty() : evidenceStep;
    }

    /**
     * 실행 순서대로의 단계 결과.
     *
     * @return 6개 StepResult
     */
    public List<StepResult> steps() {
        return List.of(entityTypeStep, attributesStep, verbContractsStep, taxonomyStep, viewsStep, evidenceStep);
    }

    /**
     * 모든 단계의 합.
     *
     * @return 합산 StepResult
     */
    public StepResult total() {
        StepResult total = StepResult.empty();
        for (StepResult step : steps()) {
            total = total.plus(step);
        }
        return total;
    }

    public int totalPublished() {
        return total().published();
    }

    public int totalSkipped() {
        return total().skipped();
    }

    public int totalUpdated() {
        return total().updated();
    }

    /**
     * 단계 순서대로 평탄화한 오류 목록.
     *
     * @return 불변 목록
     */
    public List<String> allErrors() {
        List<String> errors = new ArrayList<>();
        for (StepResult step : steps()) {
            errors.addAll(step.errors());
        }
        return List.copyOf(errors);
    }

    public boolean hasErrors() {
        return steps().stream().anyMatch(StepResult::hasErrors);
    }

    /**
     * 사람이 읽을 수 있는 보고서.
     *
     * @return 여러 줄 문자열
     */
    public String toReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("Onboarding Pipeline Result");
        if (dryRun) {
            sb.append(" (dry run)");
        }
        sb.append('\n');
        appendLine(sb, "Entity type:", entityTypeStep);
        appendLine(sb, "Attributes:", attributesStep);
        appendLine(sb, "Verb contracts:", verbContractsStep);
        appendLine(sb, "Taxonomy:", taxonomyStep);
        appendLine(sb, "Views:", viewsStep);
        appendLine(sb, "Evidence:", evidenceStep);
        appendLine(sb, "Total:", total());

        List<String> errors = allErrors();
        if (!errors.isEmpty()) {
            sb.append("  Errors (").append(errors.size()).append("):\n");
            for (int i = 0; i < errors.size(); i++) {
                sb.append("    ").append(i + 1).append(". ").append(errors.get(i)).append('\n');
            }
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String label, StepResult step) {
        sb.append(String.format("  %-16s %d published, %d skipped, %d updated\n",
            label, step.published(), step.skipped(), step.updated()));
    }
}
