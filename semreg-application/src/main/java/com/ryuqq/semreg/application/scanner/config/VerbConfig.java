package com.ryuqq.semreg.application.scanner.config;

import java.util.List;

/**
 * 단일 verb 설정.
 *
 * @param description 설명
 * @param behavior 동작 유형 (예: "crud", "plugin", "graph_query")
 * @param args 인자 목록
 * @param returns 반환 설정 (null 가능)
 * @param produces 생성 설정 (null 가능)
 * @param consumes 소비 설정 목록
 * @param lifecycle 생명주기 제약 (null 가능)
 * @param invocationPhrases 자연어 호출 문구
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record VerbConfig(
    String description,
    String behavior,
    List<ArgConfig> args,
    ReturnsConfig returns,
    ProducesConfig produces,
    List<ConsumesConfig> consumes,
    LifecycleConfig lifecycle,
    List<String> invocationPhrases
) {

    public VerbConfig {
        args = args == null ? List.of() : List.copyOf(args);
        consumes = consumes == null ? List.of() : List.copyOf(consumes);
        invocationPhrases = invocationPhrases == null ? List.of() : List.copyOf(invocationPhrases);
    }
}
