/**
 * Verb 설정에서 레지스트리 정의를 도출하는 순수 함수.
 *
 * @since 1.0.0
 */
package com.ryuqq.semreg.application.scanner.derive;
