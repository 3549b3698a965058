/**
 * 스캔 후반부에 고정 카탈로그를 게시하는 시더.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.semreg.application.scanner.seed.Seeder} - 시더 계약</li>
 *   <li>{@link com.ryuqq.semreg.application.scanner.seed.TaxonomySeeder} - 분류 체계와 노드</li>
 *   <li>{@link com.ryuqq.semreg.application.scanner.seed.DefinitionSeeder} - 뷰, 정책, 파생 명세 등</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.semreg.application.scanner.seed;
