package com.ryuqq.semreg.application.scanner.seed;

import com.ryuqq.semreg.core.definition.Definition;
import com.ryuqq.semreg.core.publish.IdempotentPublisher;
import com.ryuqq.semreg.core.publish.PublishContext;
import com.ryuqq.semreg.core.publish.PublishOutcome;

/**
 * 시더에 전달되는 게시 수단.
 *
 * @param publisher 스캔 공용 게시기
 * @param publishContext 스캔의 게시 컨텍스트
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record SeedContext(IdempotentPublisher publisher, PublishContext publishContext) {

    public SeedContext {
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (publishContext == null) {
            throw new IllegalArgumentException("publishContext cannot be null");
        }
    }

    /**
     * 정의 하나를 멱등 게시.
     *
     * @param definition 정의 본문
     * @return 게시 결과
     */
    public PublishOutcome publish(Definition definition) {
        return publisher.publish(definition, publishContext);
    }
}
