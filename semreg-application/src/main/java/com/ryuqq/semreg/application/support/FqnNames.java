package com.ryuqq.semreg.application.support;

import java.util.Locale;

/**
 * FQN에서 표시 이름을 만드는 보조 함수.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class FqnNames {

    private FqnNames() {
    }

    /**
     * 마지막 '.' 이후 구간.
     *
     * <p>'.'이 없으면 입력 전체를 반환합니다.</p>
     *
     * @param fqn FQN
     * @return 마지막 구간 (예: "entity.test-widget" → "test-widget")
     */
    public static String lastSegment(String fqn) {
        if (fqn == null) {
            throw new IllegalArgumentException("fqn cannot be null");
        }
        int dot = fqn.lastIndexOf('.');
        return dot < 0 ? fqn : fqn.substring(dot + 1);
    }

    /**
     * '-'와 '_'를 공백으로 바꾸고 각 단어를 대문자로 시작.
     *
     * <p>각 단어의 나머지 글자는 소문자가 됩니다 (예: "widget_NAME" → "Widget Name").</p>
     *
     * @param value 원본 문자열
     * @return 제목 형식 문자열
     */
    public static String titleCase(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        String[] words = value.replace('-', ' ').replace('_', ' ').split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT));
            sb.append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
