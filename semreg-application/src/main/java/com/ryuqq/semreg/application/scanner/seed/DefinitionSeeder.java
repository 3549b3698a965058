package com.ryuqq.semreg.application.scanner.seed;

import com.ryuqq.semreg.application.scanner.ScanCategory;
import com.ryuqq.semreg.core.definition.Definition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * 정의 목록을 주어진 순서대로 게시하는 범용 시더.
 *
 * <p>뷰, 정책, 파생 명세 카탈로그처럼 항목 사이에 의존이 없는 정의에 사용합니다.
 * 목록은 실행할 때마다 supplier에서 새로 얻습니다.</p>
 *
 * <p>{@link ScanCategory}에 대응하는 객체 유형만 받습니다. 소속 규칙이나 증빙 요건처럼
 * 대응 카테고리가 없는 정의가 섞여 있으면 아무것도 게시하지 않고 예외를 던집니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class DefinitionSeeder implements Seeder {

    private static final Logger log = LoggerFactory.getLogger(DefinitionSeeder.class);

    private final String name;
    private final Supplier<? extends List<? extends Definition>> definitions;

    /**
     * 생성자.
     *
     * @param name 시더 이름
     * @param definitions 게시할 정의 목록 supplier
     */
    public DefinitionSeeder(String name, Supplier<? extends List<? extends Definition>> definitions) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        this.name = name;
        this.definitions = definitions;
    }

    /**
     * 고정 목록으로 생성.
     *
     * @param name 시더 이름
     * @param definitions 게시할 정의
     * @return DefinitionSeeder
     */
    public static DefinitionSeeder of(String name, List<? extends Definition> definitions) {
        List<? extends Definition> copy = List.copyOf(requireScanCategories(definitions));
        return new DefinitionSeeder(name, () -> copy);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SeedResult preview() {
        SeedResult.Builder result = SeedResult.builder();
        for (Definition definition : requireScanCategories(definitions.get())) {
            result.plan(ScanCategory.of(definition.objectType()), 1);
        }
        return result.build();
    }

    @Override
    public SeedResult seed(SeedContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        List<? extends Definition> items = requireScanCategories(definitions.get());
        SeedResult.Builder result = SeedResult.builder();
        for (Definition definition : items) {
            result.record(context.publish(definition));
        }
        log.debug("Seeder '{}' processed {} definitions", name, items.size());
        return result.build();
    }

    private static List<? extends Definition> requireScanCategories(List<? extends Definition> items) {
        if (items == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        for (Definition definition : items) {
            if (definition == null) {
                throw new IllegalArgumentException("definition cannot be null");
            }
            if (!ScanCategory.supports(definition.objectType())) {
                throw new IllegalArgumentException(
                    "Not a scan category: " + definition.objectType() + " '" + definition.fqn() + "'"
                );
            }
        }
        return items;
    }
}
