/**
 * Verb 설정 기반 레지스트리 스캐너.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.application.scanner.RegistryScanner} - 스캔 실행</li>
 *   <li>{@link com.ryuqq.semreg.application.scanner.ScanReport} - 카테고리별 집계 보고서</li>
 *   <li>{@link com.ryuqq.semreg.application.scanner.ScannerConfig} - 세트 라벨, 생성 주체, 드리프트 사유</li>
 * </ul>
 *
 * <p>하위 패키지 {@code config}는 verb 설정 모델, {@code derive}는 정의 도출,
 * {@code seed}는 고정 카탈로그 시더를 제공합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.semreg.application.scanner;
