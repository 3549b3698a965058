/**
 * Verb 설정 모델과 로더.
 *
 * <p>스캐너의 입력인 verb 설정 파일을 불변 record로 읽어들입니다.
 * 기본 로더는 {@link com.ryuqq.semreg.application.scanner.config.YamlVerbConfigSource}입니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.semreg.application.scanner.config;
