package com.ryuqq.semreg.application.scanner.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verb 설정 파일의 최상위 구조.
 *
 * <p>도메인 순서는 파일에 선언된 순서를 유지합니다.</p>
 *
 * @param version 설정 형식 버전 (기본값 "1.0")
 * @param domains 도메인 이름별 설정
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record VerbsConfig(String version, Map<String, DomainConfig> domains) {

    /**
     * 버전이 지정되지 않았을 때의 기본값.
     */
    public static final String DEFAULT_VERSION = "1.0";

    public VerbsConfig {
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
        domains = domains == null ? Map.of() : new LinkedHashMap<>(domains);
    }

    /**
     * 선언된 verb 총 개수.
     *
     * @return verb 수
     */
    public int verbCount() {
        return domains.values().stream().mapToInt(domain -> domain.verbs().size()).sum();
    }
}
