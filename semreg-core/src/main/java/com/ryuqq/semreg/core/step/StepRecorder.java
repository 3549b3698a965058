package com.ryuqq.semreg.core.step;

import com.ryuqq.semreg.core.publish.PublishOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * 단계 실행 중 항목별 결과를 누적하는 기록기.
 *
 * <p>단계 시작 시 생성되고 항목마다 정확히 한 번 기록된 뒤
 * {@link #toResult()}로 불변 {@link StepResult}를 반환합니다.</p>
 *
 * <p>Thread-safe하지 않습니다. 한 단계는 한 스레드에서 순차 실행됩니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class StepRecorder {

    private int published;
    private int skipped;
    private int updated;
    private final List<String> errors = new ArrayList<>();

    /**
     * 새 항목 게시 기록.
     */
    public void recordPublish() {
        published++;
    }

    /**
     * dry run 등에서 여러 항목의 게시 예정 기록.
     *
     * @param count 항목 수
     * @throws IllegalArgumentException count가 음수인 경우
     */
    public void recordPublishes(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative");
        }
        published += count;
    }

    /**
     * 건너뜀 기록.
     */
    public void recordSkip() {
        skipped++;
    }

    /**
     * 갱신 기록.
     */
    public void recordUpdate() {
        updated++;
    }

    /**
     * 오류 기록.
     *
     * @param message 오류 메시지
     */
    public void recordError(String message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        errors.add(message);
    }

    /**
     * 게시 결과에 따라 해당 카운터 증가.
     *
     * @param outcome 게시 결과
     */
    public void record(PublishOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (outcome.isInserted()) {
            recordPublish();
        } else if (outcome.isSkipped()) {
            recordSkip();
        } else {
            recordUpdate();
        }
    }

    /**
     * 현재까지의 기록을 불변 결과로 변환.
     *
     * @return StepResult
     */
    public StepResult toResult() {
        return new StepResult(published, skipped, updated, errors);
    }
}
