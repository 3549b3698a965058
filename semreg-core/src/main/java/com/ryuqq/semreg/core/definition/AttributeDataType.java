package com.ryuqq.semreg.core.definition;

/**
 * 속성 데이터 타입.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public enum AttributeDataType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    UUID,
    DATE,
    TIMESTAMP,
    ENUM,
    JSON
}
