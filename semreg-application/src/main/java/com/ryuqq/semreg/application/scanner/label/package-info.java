/**
 * 정의 FQN과 도메인에서 보안 라벨을 제안하는 순수 함수.
 *
 * @since 1.0.0
 */
package com.ryuqq.semreg.application.scanner.label;
