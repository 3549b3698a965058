/**
 * 엔티티 유형 온보딩 파이프라인.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.application.onboarding.OnboardingPipeline} - 6단계 온보딩 실행</li>
 *   <li>{@link com.ryuqq.semreg.application.onboarding.OnboardingRequest} - 요청 (JSON 호환)</li>
 *   <li>{@link com.ryuqq.semreg.application.onboarding.OnboardingResult} - 단계별 결과와 보고서</li>
 *   <li>{@link com.ryuqq.semreg.application.onboarding.OnboardingDefaults} - 기본값 생성 전략</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.semreg.application.onboarding;
