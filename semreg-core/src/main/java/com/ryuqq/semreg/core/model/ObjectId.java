package com.ryuqq.semreg.core.model;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * 콘텐츠 주소 기반 객체 식별자.
 *
 * <p>ObjectId는 (ObjectType, FQN) 쌍에서 결정적으로 파생되며,
 * 동일 객체의 모든 버전(스냅샷)이 공유하는 고정 앵커입니다.
 * 스냅샷의 기본 키가 아니라는 점에 주의하세요. 스냅샷은 {@link SnapshotId}로 식별됩니다.</p>
 *
 * <p><strong>파생 규칙:</strong></p>
 * <pre>
 * SHA-256(UTF-8(wireName + ":" + fqn)) → 앞 16바이트 → UUID (version 5, IETF variant)
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>동일한 (type, fqn)은 프로세스/실행과 무관하게 항상 동일한 ObjectId</li>
 *   <li>서로 다른 (type, fqn)의 충돌 확률은 무시 가능</li>
 * </ul>
 *
 * @param value UUID 값
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public record ObjectId(UUID value) {

    private static final int UUID_BYTES = 16;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public ObjectId {
        if (value == null) {
            throw new IllegalArgumentException("ObjectId value cannot be null");
        }
    }

    /**
     * (ObjectType, FQN)에서 ObjectId 파생.
     *
     * @param objectType 객체 유형
     * @param fqn 정규화된 이름
     * @return 결정적으로 파생된 ObjectId
     * @throws IllegalArgumentException objectType이 null이거나 fqn이 null/빈 문자열인 경우
     */
    public static ObjectId of(ObjectType objectType, String fqn) {
        if (objectType == null) {
            throw new IllegalArgumentException("objectType cannot be null");
        }
        if (fqn == null || fqn.isBlank()) {
            throw new IllegalArgumentException("fqn cannot be null or blank");
        }

        byte[] hashed = sha256(objectType.wireName() + ":" + fqn);
        byte[] bytes = new byte[UUID_BYTES];
        System.arraycopy(hashed, 0, bytes, 0, UUID_BYTES);
        bytes[6] = (byte) ((bytes[6] & 0x0f) | 0x50);
        bytes[8] = (byte) ((bytes[8] & 0x3f) | 0x80);

        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new ObjectId(new UUID(buffer.getLong(), buffer.getLong()));
    }

    /**
     * 문자열 표현에서 ObjectId 복원.
     *
     * @param value UUID 문자열
     * @return ObjectId
     * @throws IllegalArgumentException UUID 형식이 아닌 경우
     */
    public static ObjectId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ObjectId value cannot be null");
        }
        return new ObjectId(UUID.fromString(value));
    }

    private static byte[] sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
