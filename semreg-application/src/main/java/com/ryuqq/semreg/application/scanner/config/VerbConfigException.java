package com.ryuqq.semreg.application.scanner.config;

/**
 * Verb 설정을 읽거나 해석할 수 없을 때 발생하는 예외.
 *
 * <p>스캔 전체를 중단시키는 치명적 오류입니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class VerbConfigException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public VerbConfigException(String message) {
        super(message);
    }

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public VerbConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
