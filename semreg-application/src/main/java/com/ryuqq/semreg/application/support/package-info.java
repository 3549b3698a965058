/**
 * 애플리케이션 계층 공용 보조 함수.
 *
 * @since 1.0.0
 */
package com.ryuqq.semreg.application.support;
