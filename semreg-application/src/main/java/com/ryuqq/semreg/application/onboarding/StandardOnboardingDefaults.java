package com.ryuqq.semreg.application.onboarding;

import com.ryuqq.semreg.application.support.FqnNames;
import com.ryuqq.semreg.core.definition.AttributeDataType;
import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody.DbTableMapping;
import com.ryuqq.semreg.core.definition.MembershipRuleBody;
import com.ryuqq.semreg.core.definition.MembershipRuleBody.MembershipKind;
import com.ryuqq.semreg.core.definition.VerbContractBody;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbArgDef;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbArgLookup;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbProducesSpec;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbReturnSpec;
import com.ryuqq.semreg.core.definition.ViewColumn;
import com.ryuqq.semreg.core.model.ObjectType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 기본 {@link OnboardingDefaults} 구현.
 *
 * <p><strong>생성 규칙:</strong></p>
 * <ul>
 *   <li>속성: 필수 속성 FQN, 선택 속성 FQN 순서로 하나씩 (STRING 타입)</li>
 *   <li>Verb 계약: {@code <entity-fqn>.create|read|update|delete}, 인자 이름과 문구는 엔티티 FQN의 마지막 구간 사용</li>
 *   <li>분류 체계: {@code taxonomy.<domain>}</li>
 *   <li>뷰: {@code view.<domain>}</li>
 *   <li>소속 규칙: {@code <taxonomy>.member.<entity>}, DIRECT</li>
 *   <li>뷰 컬럼: 선언된 모든 속성</li>
 * </ul>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public class StandardOnboardingDefaults implements OnboardingDefaults {

    static final String TAXONOMY_PREFIX = "taxonomy.";
    static final String VIEW_PREFIX = "view.";
    static final String MEMBER_SEGMENT = ".member.";
    static final String CRUD_BEHAVIOR = "crud";

    private static final List<String> CRUD_ACTIONS = List.of("create", "read", "update", "delete");

    @Override
    public List<AttributeDefBody> defaultAttributes(EntityTypeDefBody entityType) {
        requireEntityType(entityType);
        List<AttributeDefBody> attributes = new ArrayList<>();
        for (String fqn : entityType.requiredAttributes()) {
            attributes.add(attribute(entityType, fqn, true));
        }
        for (String fqn : entityType.optionalAttributes()) {
            attributes.add(attribute(entityType, fqn, false));
        }
        return List.copyOf(attributes);
    }

    @Override
    public List<VerbContractBody> defaultVerbContracts(EntityTypeDefBody entityType) {
        requireEntityType(entityType);
        List<VerbContractBody> contracts = new ArrayList<>();
        for (String action : CRUD_ACTIONS) {
            contracts.add(crudContract(entityType, action));
        }
        return List.copyOf(contracts);
    }

    @Override
    public List<String> defaultTaxonomyFqns(EntityTypeDefBody entityType) {
        requireEntityType(entityType);
        return List.of(TAXONOMY_PREFIX + entityType.domain());
    }

    @Override
    public List<String> defaultViewFqns(EntityTypeDefBody entityType) {
        requireEntityType(entityType);
        return List.of(VIEW_PREFIX + entityType.domain());
    }

    @Override
    public MembershipRuleBody membershipRule(EntityTypeDefBody entityType, String taxonomyFqn) {
        requireEntityType(entityType);
        if (taxonomyFqn == null) {
            throw new IllegalArgumentException("taxonomyFqn cannot be null");
        }
        return new MembershipRuleBody(
            taxonomyFqn + MEMBER_SEGMENT + entityType.fqn(),
            entityType.name() + " in " + taxonomyFqn,
            "Places " + entityType.fqn() + " in taxonomy " + taxonomyFqn,
            taxonomyFqn,
            taxonomyFqn,
            MembershipKind.DIRECT,
            ObjectType.ENTITY_TYPE_DEF.wireName(),
            entityType.fqn(),
            List.of()
        );
    }

    @Override
    public List<ViewColumn> columnsForView(EntityTypeDefBody entityType, String viewFqn) {
        requireEntityType(entityType);
        List<ViewColumn> columns = new ArrayList<>();
        for (String attributeFqn : entityType.declaredAttributes()) {
            columns.add(new ViewColumn(
                attributeFqn,
                FqnNames.titleCase(FqnNames.lastSegment(attributeFqn)),
                entityType.fqn()
            ));
        }
        return List.copyOf(columns);
    }

    private static AttributeDefBody attribute(EntityTypeDefBody entityType, String fqn, boolean required) {
        String name = FqnNames.titleCase(FqnNames.lastSegment(fqn));
        return new AttributeDefBody(
            fqn,
            name,
            name + " of " + entityType.name(),
            entityType.domain(),
            AttributeDataType.STRING,
            null,
            null,
            required,
            null
        );
    }

    private static VerbContractBody crudContract(EntityTypeDefBody entityType, String action) {
        String noun = FqnNames.lastSegment(entityType.fqn());
        String displayNoun = FqnNames.titleCase(noun);
        String idArg = noun + "-id";

        List<VerbArgDef> args = new ArrayList<>();
        VerbReturnSpec returns;
        VerbProducesSpec produces = null;
        switch (action) {
            case "create":
                for (String fqn : entityType.requiredAttributes()) {
                    args.add(new VerbArgDef(FqnNames.lastSegment(fqn), "string", true, null, null, null, null));
                }
                for (String fqn : entityType.optionalAttributes()) {
                    args.add(new VerbArgDef(FqnNames.lastSegment(fqn), "string", false, null, null, null, null));
                }
                returns = new VerbReturnSpec("uuid", null);
                produces = new VerbProducesSpec(entityType.fqn(), false);
                break;
            case "read":
                args.add(idArg(idArg, entityType));
                returns = new VerbReturnSpec("record", null);
                break;
            case "update":
                args.add(idArg(idArg, entityType));
                for (String fqn : entityType.declaredAttributes()) {
                    args.add(new VerbArgDef(FqnNames.lastSegment(fqn), "string", false, null, null, null, null));
                }
                returns = new VerbReturnSpec("affected", null);
                break;
            case "delete":
                args.add(idArg(idArg, entityType));
                returns = new VerbReturnSpec("affected", null);
                break;
            default:
                throw new IllegalArgumentException("Unknown CRUD action: " + action);
        }

        String verbPhrase = action + " " + displayNoun.toLowerCase(Locale.ROOT);
        return new VerbContractBody(
            entityType.fqn() + "." + action,
            entityType.domain(),
            action,
            FqnNames.titleCase(action) + " a " + displayNoun,
            CRUD_BEHAVIOR,
            args,
            returns,
            null,
            null,
            produces,
            null,
            List.of(verbPhrase)
        );
    }

    private static VerbArgDef idArg(String name, EntityTypeDefBody entityType) {
        DbTableMapping table = entityType.dbTable();
        VerbArgLookup lookup = table == null
            ? null
            : new VerbArgLookup(table.table(), entityType.fqn(), table.schema(), table.nameColumn(), table.primaryKey());
        return new VerbArgDef(name, "uuid", true, "Identifier of the " + entityType.name(), lookup, null, null);
    }

    private static void requireEntityType(EntityTypeDefBody entityType) {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
    }
}
