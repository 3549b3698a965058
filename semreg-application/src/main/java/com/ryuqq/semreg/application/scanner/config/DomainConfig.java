package com.ryuqq.semreg.application.scanner.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 도메인 단위 verb 묶음.
 *
 * @param description 도메인 설명
 * @param verbs action 이름별 verb 설정
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record DomainConfig(String description, Map<String, VerbConfig> verbs) {

    public DomainConfig {
        verbs = verbs == null ? Map.of() : new LinkedHashMap<>(verbs);
    }
}
