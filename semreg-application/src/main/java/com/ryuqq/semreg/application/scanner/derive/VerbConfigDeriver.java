package com.ryuqq.semreg.application.scanner.derive;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.semreg.application.scanner.config.ArgConfig;
import com.ryuqq.semreg.application.scanner.config.ConsumesConfig;
import com.ryuqq.semreg.application.scanner.config.DomainConfig;
import com.ryuqq.semreg.application.scanner.config.LifecycleConfig;
import com.ryuqq.semreg.application.scanner.config.LookupConfig;
import com.ryuqq.semreg.application.scanner.config.VerbConfig;
import com.ryuqq.semreg.application.scanner.config.VerbsConfig;
import com.ryuqq.semreg.application.support.FqnNames;
import com.ryuqq.semreg.core.definition.AttributeDataType;
import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.definition.AttributeDefBody.AttributeSource;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody.DbTableMapping;
import com.ryuqq.semreg.core.definition.VerbContractBody;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbArgDef;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbArgLookup;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbPrecondition;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbProducesSpec;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbReturnSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Verb 설정 기반 기본 {@link DefinitionDeriver}.
 *
 * <p><strong>도출 규칙:</strong></p>
 * <ul>
 *   <li>Verb 계약: verb마다 하나, FQN {@code <domain>.<action>}</li>
 *   <li>엔티티 유형: 인자 lookup마다 {@code <domain>.<entity_type 또는 table>},
 *       스키마가 없으면 {@value #DEFAULT_SCHEMA}</li>
 *   <li>속성: 인자마다 {@code <domain>.<arg name>}</li>
 * </ul>
 *
 * <p>같은 FQN이 여러 번 나오면 설정 파일에서 먼저 나온 것이 이깁니다.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class VerbConfigDeriver implements DefinitionDeriver {

    /**
     * lookup에 스키마가 없을 때 사용하는 스키마.
     */
    public static final String DEFAULT_SCHEMA = "ob-poc";

    static final String REQUIRES_STATE = "requires_state";
    static final String PRECONDITION_CHECK = "precondition_check";

    @Override
    public DerivedDefinitions derive(VerbsConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        List<VerbContractBody> contracts = new ArrayList<>();
        for (Map.Entry<String, DomainConfig> domain : config.domains().entrySet()) {
            for (Map.Entry<String, VerbConfig> verb : domain.getValue().verbs().entrySet()) {
                contracts.add(toContract(domain.getKey(), verb.getKey(), verb.getValue()));
            }
        }
        contracts.sort(Comparator.comparing(VerbContractBody::fqn));
        return new DerivedDefinitions(contracts, inferEntityTypes(config), inferAttributes(config));
    }

    /**
     * 단일 verb 설정을 계약으로 변환.
     *
     * @param domain 도메인
     * @param action action 이름
     * @param verb verb 설정
     * @return VerbContractBody
     */
    public VerbContractBody toContract(String domain, String action, VerbConfig verb) {
        if (verb == null) {
            throw new IllegalArgumentException("verb cannot be null");
        }
        List<VerbArgDef> args = new ArrayList<>();
        for (ArgConfig arg : verb.args()) {
            args.add(new VerbArgDef(
                arg.name(),
                lower(arg.type()),
                arg.required(),
                arg.description(),
                toLookup(arg.lookup()),
                arg.validValues(),
                defaultText(arg.defaultValue())
            ));
        }

        VerbReturnSpec returns = verb.returns() == null
            ? null
            : new VerbReturnSpec(lower(verb.returns().type()), null);
        VerbProducesSpec produces = verb.produces() == null
            ? null
            : new VerbProducesSpec(verb.produces().type(), verb.produces().resolved());
        List<String> consumes = verb.consumes().stream().map(ConsumesConfig::type).toList();

        return new VerbContractBody(
            domain + "." + action,
            domain,
            action,
            verb.description(),
            lower(verb.behavior()),
            args,
            returns,
            preconditions(verb.lifecycle()),
            List.of(),
            produces,
            consumes,
            verb.invocationPhrases()
        );
    }

    /**
     * 인자 lookup에서 엔티티 유형 추론.
     *
     * @param config verb 설정
     * @return FQN 순으로 정렬된 엔티티 유형
     */
    public List<EntityTypeDefBody> inferEntityTypes(VerbsConfig config) {
        Map<String, EntityTypeDefBody> seen = new TreeMap<>();
        for (Map.Entry<String, DomainConfig> domainEntry : config.domains().entrySet()) {
            String domain = domainEntry.getKey();
            for (VerbConfig verb : domainEntry.getValue().verbs().values()) {
                for (ArgConfig arg : verb.args()) {
                    LookupConfig lookup = arg.lookup();
                    if (lookup == null) {
                        continue;
                    }
                    String entityType = lookup.effectiveEntityType();
                    String fqn = domain + "." + entityType;
                    seen.computeIfAbsent(fqn, key -> new EntityTypeDefBody(
                        key,
                        FqnNames.titleCase(entityType),
                        "Entity type inferred from " + domain + "." + entityType + " lookup",
                        domain,
                        new DbTableMapping(
                            lookup.schema() == null ? DEFAULT_SCHEMA : lookup.schema(),
                            lookup.table(),
                            lookup.primaryKey(),
                            lookup.primarySearchColumn()
                        ),
                        null,
                        null,
                        null,
                        null
                    ));
                }
            }
        }
        return List.copyOf(seen.values());
    }

    /**
     * 인자 정의에서 속성 추론.
     *
     * @param config verb 설정
     * @return FQN 순으로 정렬된 속성
     */
    public List<AttributeDefBody> inferAttributes(VerbsConfig config) {
        Map<String, AttributeDefBody> seen = new TreeMap<>();
        for (Map.Entry<String, DomainConfig> domainEntry : config.domains().entrySet()) {
            String domain = domainEntry.getKey();
            for (Map.Entry<String, VerbConfig> verbEntry : domainEntry.getValue().verbs().entrySet()) {
                String action = verbEntry.getKey();
                for (ArgConfig arg : verbEntry.getValue().args()) {
                    String fqn = domain + "." + arg.name();
                    seen.computeIfAbsent(fqn, key -> toAttribute(key, domain, action, arg));
                }
            }
        }
        return List.copyOf(seen.values());
    }

    /**
     * 인자 타입을 속성 데이터 타입으로 매핑.
     *
     * @param arg 인자 설정
     * @return AttributeDataType
     */
    public static AttributeDataType attributeType(ArgConfig arg) {
        if (arg == null) {
            throw new IllegalArgumentException("arg cannot be null");
        }
        String type = arg.type() == null ? "" : lower(arg.type());
        switch (type) {
            case "string":
                return AttributeDataType.STRING;
            case "integer":
            case "int":
                return AttributeDataType.INTEGER;
            case "decimal":
            case "number":
            case "float":
                return AttributeDataType.DECIMAL;
            case "boolean":
            case "bool":
                return AttributeDataType.BOOLEAN;
            case "uuid":
                return AttributeDataType.UUID;
            case "date":
                return AttributeDataType.DATE;
            case "timestamp":
                return AttributeDataType.TIMESTAMP;
            default:
                return arg.declaresValidValues() ? AttributeDataType.ENUM : AttributeDataType.STRING;
        }
    }

    private static AttributeDefBody toAttribute(String fqn, String domain, String action, ArgConfig arg) {
        AttributeDataType dataType = attributeType(arg);
        String description = arg.description() != null
            ? arg.description()
            : "Attribute inferred from " + domain + "." + action + " arg '" + arg.name() + "'";
        AttributeSource source = new AttributeSource(
            domain + "." + action,
            arg.mapsTo() == null ? null : domain,
            arg.mapsTo(),
            false
        );
        return new AttributeDefBody(
            fqn,
            FqnNames.titleCase(arg.name()),
            description,
            domain,
            dataType,
            dataType == AttributeDataType.ENUM ? arg.validValues() : null,
            source,
            arg.required(),
            null
        );
    }

    private static VerbArgLookup toLookup(LookupConfig lookup) {
        if (lookup == null) {
            return null;
        }
        return new VerbArgLookup(
            lookup.table(),
            lookup.effectiveEntityType(),
            lookup.schema(),
            lookup.primarySearchColumn(),
            lookup.primaryKey()
        );
    }

    private static List<VerbPrecondition> preconditions(LifecycleConfig lifecycle) {
        if (lifecycle == null) {
            return List.of();
        }
        List<VerbPrecondition> preconditions = new ArrayList<>();
        for (String state : lifecycle.requiresStates()) {
            preconditions.add(new VerbPrecondition(REQUIRES_STATE, state, null));
        }
        for (String check : lifecycle.preconditionChecks()) {
            preconditions.add(new VerbPrecondition(PRECONDITION_CHECK, check, null));
        }
        return preconditions;
    }

    private static String defaultText(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
