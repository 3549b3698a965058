package com.ryuqq.semreg.core.definition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.semreg.core.model.DefinitionHash;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 정의 본문의 JSON 변환과 콘텐츠 해시 계산.
 *
 * <p><strong>직렬화 규칙:</strong></p>
 * <ul>
 *   <li>프로퍼티 이름: snake_case ({@code requiredAttributes} → {@code required_attributes})</li>
 *   <li>null 필드는 생략</li>
 *   <li>알 수 없는 필드는 역직렬화 시 무시</li>
 *   <li>열거형 값은 대소문자 구분 없이 역직렬화</li>
 * </ul>
 *
 * <p><strong>해시 규칙:</strong></p>
 * <pre>
 * hash = hex(SHA-256(UTF-8(canonical JSON)))
 * canonical JSON = 객체 키를 재귀적으로 정렬, 배열 순서는 유지, 공백 없음
 * </pre>
 *
 * <p>정의는 동적으로 순서가 정해지는 맵에서 만들어지므로, 키 삽입 순서가 달라도
 * 같은 내용이면 같은 해시가 나와야 합니다. 값이 한 바이트라도 다르면 해시도 달라집니다.</p>
 *
 * <p>Thread-safe: 내부 {@link ObjectMapper}는 설정 이후 변경되지 않습니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class DefinitionCodec {

    private final ObjectMapper objectMapper;

    /**
     * 기본 설정으로 생성.
     */
    public DefinitionCodec() {
        this.objectMapper = JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
    }

    /**
     * 정의 본문을 JSON 트리로 변환.
     *
     * @param definition 정의 본문
     * @return JSON 객체 트리
     * @throws IllegalArgumentException definition이 null인 경우
     * @throws DefinitionSerializationException 변환에 실패한 경우
     */
    public ObjectNode toTree(Definition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        try {
            JsonNode tree = objectMapper.valueToTree(definition);
            if (!(tree instanceof ObjectNode objectNode)) {
                throw new DefinitionSerializationException(
                    "Definition " + definition.fqn() + " did not serialize to a JSON object", null
                );
            }
            return objectNode;
        } catch (IllegalArgumentException e) {
            throw new DefinitionSerializationException(
                "Failed to serialize " + definition.objectType() + " '" + definition.fqn() + "'", e
            );
        }
    }

    /**
     * JSON 트리를 정의 본문으로 변환.
     *
     * @param tree JSON 트리
     * @param type 본문 타입
     * @param <T> 본문 타입
     * @return 정의 본문
     * @throws IllegalArgumentException tree 또는 type이 null인 경우
     * @throws DefinitionSerializationException 변환에 실패한 경우
     */
    public <T extends Definition> T fromTree(JsonNode tree, Class<T> type) {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        try {
            return objectMapper.treeToValue(tree, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DefinitionSerializationException(
                "Failed to parse " + type.getSimpleName() + ": " + e.getMessage(), e
            );
        }
    }

    /**
     * 객체 키를 재귀적으로 정렬한 사본 생성.
     *
     * @param node 원본 트리 (변경되지 않음)
     * @return 정규화된 트리
     */
    public JsonNode canonicalize(JsonNode node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> iterator = node.fieldNames();
            while (iterator.hasNext()) {
                names.add(iterator.next());
            }
            Collections.sort(names);

            ObjectNode sorted = objectMapper.createObjectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = objectMapper.createArrayNode();
            for (JsonNode element : node) {
                copy.add(canonicalize(element));
            }
            return copy;
        }
        return node;
    }

    /**
     * 정규화된 JSON 바이트열.
     *
     * @param node JSON 트리
     * @return UTF-8 canonical JSON
     */
    public byte[] canonicalBytes(JsonNode node) {
        try {
            return objectMapper.writeValueAsBytes(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new DefinitionSerializationException("Failed to write canonical JSON", e);
        }
    }

    /**
     * JSON 트리의 콘텐츠 해시.
     *
     * @param definition 정의 페이로드
     * @return DefinitionHash
     */
    public DefinitionHash hash(JsonNode definition) {
        byte[] hashed = sha256(canonicalBytes(definition));
        StringBuilder builder = new StringBuilder(hashed.length * 2);
        for (byte value : hashed) {
            builder.append(String.format("%02x", value));
        }
        return new DefinitionHash(builder.toString());
    }

    /**
     * 정의 본문의 콘텐츠 해시.
     *
     * @param definition 정의 본문
     * @return DefinitionHash
     */
    public DefinitionHash hash(Definition definition) {
        return hash(toTree(definition));
    }

    /**
     * 이 코덱이 사용하는 ObjectMapper.
     *
     * <p>요청 본문처럼 정의를 포함하는 다른 값을 같은 규칙으로 읽고 쓸 때 사용합니다.</p>
     *
     * @return ObjectMapper
     */
    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
