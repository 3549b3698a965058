package com.ryuqq.semreg.application.scanner.label;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 정의 FQN, 도메인, 태그에서 보안 라벨을 제안합니다.
 *
 * <p><strong>판정 순서 (먼저 맞는 것이 이김):</strong></p>
 * <ol>
 *   <li>제재: 도메인이 {@code sanctions}/{@code screening}이거나 태그 {@code sanctions}
 *       → RESTRICTED, 반출 금지, 외부 LLM 금지</li>
 *   <li>개인정보: FQN에 개인 식별 키워드가 있거나 태그 {@code pii}/{@code personal_data}
 *       → CONFIDENTIAL, 기본 마스킹</li>
 *   <li>금융: 도메인이 거래/청구/요율 계열이거나 태그 {@code financial}
 *       → CONFIDENTIAL, 외부 LLM 금지</li>
 *   <li>그 외: {@link SecurityLabel#defaultLabel()}</li>
 * </ol>
 *
 * <p>모든 입력은 소문자로 비교합니다. 상태가 없으므로 스레드 안전합니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class SecurityLabelSuggester {

    private static final List<String> PII_KEYWORDS = List.of(
        "name", "address", "dob", "date_of_birth", "birth_date", "ssn", "social_security",
        "passport", "national_id", "tax_id", "phone", "email", "bank_account", "iban"
    );
    private static final Set<String> PII_TAGS = Set.of("pii", "personal_data");
    private static final Set<String> SANCTIONS_DOMAINS = Set.of("sanctions", "screening");
    private static final Set<String> FINANCIAL_DOMAINS = Set.of("deal", "billing", "rate", "fee", "invoice", "contract");

    /**
     * 보안 라벨 제안.
     *
     * @param fqn 정의 FQN
     * @param domain 정의 도메인 (null이면 빈 문자열로 취급)
     * @param tags 정의 태그 (null이면 빈 목록으로 취급)
     * @return 제안된 라벨
     * @throws IllegalArgumentException fqn이 null인 경우
     */
    public SecurityLabel suggest(String fqn, String domain, List<String> tags) {
        if (fqn == null) {
            throw new IllegalArgumentException("fqn cannot be null");
        }
        String lowerFqn = fqn.toLowerCase(Locale.ROOT);
        String lowerDomain = domain == null ? "" : domain.toLowerCase(Locale.ROOT);
        List<String> lowerTags = tags == null ? List.of() : tags.stream()
            .filter(tag -> tag != null)
            .map(tag -> tag.toLowerCase(Locale.ROOT))
            .toList();

        boolean pii = PII_KEYWORDS.stream().anyMatch(lowerFqn::contains)
            || lowerTags.stream().anyMatch(PII_TAGS::contains);
        boolean sanctions = SANCTIONS_DOMAINS.contains(lowerDomain) || lowerTags.contains("sanctions");
        boolean financial = FINANCIAL_DOMAINS.contains(lowerDomain) || lowerTags.contains("financial");

        if (sanctions) {
            return new SecurityLabel(
                Classification.RESTRICTED, pii, List.of(), List.of("operations"),
                List.of(HandlingControl.NO_EXPORT, HandlingControl.NO_LLM_EXTERNAL)
            );
        }
        if (pii) {
            return new SecurityLabel(
                Classification.CONFIDENTIAL, true, List.of(), List.of("operations", "audit"),
                List.of(HandlingControl.MASK_BY_DEFAULT)
            );
        }
        if (financial) {
            return new SecurityLabel(
                Classification.CONFIDENTIAL, false, List.of(), List.of(),
                List.of(HandlingControl.NO_LLM_EXTERNAL)
            );
        }
        return SecurityLabel.defaultLabel();
    }
}
