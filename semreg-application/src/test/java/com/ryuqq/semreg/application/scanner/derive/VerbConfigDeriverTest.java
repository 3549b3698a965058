package com.ryuqq.semreg.application.scanner.derive;

import com.ryuqq.semreg.application.scanner.config.ArgConfig;
import com.ryuqq.semreg.application.scanner.config.VerbsConfig;
import com.ryuqq.semreg.application.scanner.config.YamlVerbConfigSource;
import com.ryuqq.semreg.core.definition.AttributeDataType;
import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.definition.Definition;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;
import com.ryuqq.semreg.core.definition.VerbContractBody;
import com.ryuqq.semreg.core.definition.VerbContractBody.VerbPrecondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * VerbConfigDeriver 테스트.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
class VerbConfigDeriverTest {

    private final VerbConfigDeriver deriver = new VerbConfigDeriver();
    private VerbsConfig config;

    @BeforeEach
    void setUp() throws Exception {
        Path path = Path.of(getClass().getResource("/verbs/verbs.yaml").toURI());
        config = new YamlVerbConfigSource(path).load();
    }

    @Test
    void derive_verb마다_계약_하나를_FQN_순으로() {
        // when
        DerivedDefinitions derived = deriver.derive(config);

        // then
        assertThat(derived.verbContracts())
            .extracting(VerbContractBody::fqn)
            .containsExactly("cbu.assign-role", "cbu.create", "kyc.open-case");
        assertThat(derived.size()).isEqualTo(3 + 5 + 9);
    }

    @Test
    void derive_계약_필드_변환() {
        // when
        DerivedDefinitions derived = deriver.derive(config);
        VerbContractBody create = find(derived.verbContracts(), "cbu.create");
        VerbContractBody assignRole = find(derived.verbContracts(), "cbu.assign-role");

        // then
        assertThat(create.domain()).isEqualTo("cbu");
        assertThat(create.action()).isEqualTo("create");
        assertThat(create.behavior()).isEqualTo("plugin");
        assertThat(create.returns().returnType()).isEqualTo("uuid");
        assertThat(create.produces().entityType()).isEqualTo("cbu");
        assertThat(create.produces().resolved()).isFalse();
        assertThat(create.preconditions()).isEmpty();
        assertThat(create.postconditions()).isEmpty();
        assertThat(create.invocationPhrases()).containsExactly("create cbu", "onboard client");
        assertThat(create.args().get(2).defaultValue()).isEqualTo("fund");
        assertThat(create.args().get(2).validValues()).containsExactly("fund", "corporate");

        assertThat(assignRole.consumes()).containsExactly("cbu");
        assertThat(assignRole.preconditions()).containsExactly(
            new VerbPrecondition("requires_state", "active", null),
            new VerbPrecondition("precondition_check", "cbu_not_frozen", null)
        );
        assertThat(assignRole.args().get(1).lookup().searchKey()).isEqualTo("search_name");
        assertThat(assignRole.args().get(1).lookup().entityType()).isEqualTo("entities");
    }

    @Test
    void derive_lookup에서_엔티티_유형_추론() {
        // when
        List<EntityTypeDefBody> entityTypes = deriver.derive(config).entityTypes();

        // then
        assertThat(entityTypes)
            .extracting(EntityTypeDefBody::fqn)
            .containsExactly("cbu.cbus", "cbu.entities", "cbu.jurisdiction", "cbu.roles", "kyc.cbus");

        EntityTypeDefBody entities = find(entityTypes, "cbu.entities");
        assertThat(entities.name()).isEqualTo("Entities");
        assertThat(entities.domain()).isEqualTo("cbu");
        assertThat(entities.description()).isEqualTo("Entity type inferred from cbu.entities lookup");
        assertThat(entities.dbTable().schema()).isEqualTo(VerbConfigDeriver.DEFAULT_SCHEMA);
        assertThat(entities.dbTable().table()).isEqualTo("entities");
        assertThat(entities.dbTable().primaryKey()).isEqualTo("entity_id");
        assertThat(entities.dbTable().nameColumn()).isEqualTo("search_name");

        EntityTypeDefBody roles = find(entityTypes, "cbu.roles");
        assertThat(roles.dbTable().nameColumn()).isEqualTo("name");
        assertThat(roles.dbTable().primaryKey()).isEqualTo("role_id");

        assertThat(find(entityTypes, "kyc.cbus").dbTable().nameColumn()).isEqualTo("name");
        assertThat(find(entityTypes, "cbu.jurisdiction").dbTable().table()).isEqualTo("jurisdictions");
    }

    @Test
    void derive_인자에서_속성_추론() {
        // when
        List<AttributeDefBody> attributes = deriver.derive(config).attributes();

        // then
        assertThat(attributes)
            .extracting(AttributeDefBody::fqn)
            .containsExactly(
                "cbu.cbu-id", "cbu.client-type", "cbu.entity-id", "cbu.jurisdiction", "cbu.name",
                "cbu.role", "kyc.cbu-id", "kyc.risk-score", "kyc.tier"
            );

        AttributeDefBody name = find(attributes, "cbu.name");
        assertThat(name.dataType()).isEqualTo(AttributeDataType.STRING);
        assertThat(name.required()).isTrue();
        assertThat(name.source().producingVerb()).isEqualTo("cbu.create");
        assertThat(name.source().table()).isEqualTo("cbu");
        assertThat(name.source().column()).isEqualTo("name");

        AttributeDefBody riskScore = find(attributes, "kyc.risk-score");
        assertThat(riskScore.name()).isEqualTo("Risk Score");
        assertThat(riskScore.dataType()).isEqualTo(AttributeDataType.INTEGER);
        assertThat(riskScore.description()).isEqualTo("Attribute inferred from kyc.open-case arg 'risk-score'");
        assertThat(riskScore.source().table()).isNull();

        AttributeDefBody tier = find(attributes, "kyc.tier");
        assertThat(tier.dataType()).isEqualTo(AttributeDataType.ENUM);
        assertThat(tier.validValues()).containsExactly("gold", "silver");

        AttributeDefBody clientType = find(attributes, "cbu.client-type");
        assertThat(clientType.dataType()).isEqualTo(AttributeDataType.STRING);
        assertThat(clientType.validValues()).isNull();
    }

    @Test
    void derive_같은_설정이면_같은_결과() {
        assertThat(deriver.derive(config)).isEqualTo(deriver.derive(config));
    }

    @Test
    void attributeType_타입_매핑() {
        assertThat(VerbConfigDeriver.attributeType(arg("int", null))).isEqualTo(AttributeDataType.INTEGER);
        assertThat(VerbConfigDeriver.attributeType(arg("Number", null))).isEqualTo(AttributeDataType.DECIMAL);
        assertThat(VerbConfigDeriver.attributeType(arg("bool", null))).isEqualTo(AttributeDataType.BOOLEAN);
        assertThat(VerbConfigDeriver.attributeType(arg("uuid", null))).isEqualTo(AttributeDataType.UUID);
        assertThat(VerbConfigDeriver.attributeType(arg("date", null))).isEqualTo(AttributeDataType.DATE);
        assertThat(VerbConfigDeriver.attributeType(arg("timestamp", null))).isEqualTo(AttributeDataType.TIMESTAMP);
        assertThat(VerbConfigDeriver.attributeType(arg("lookup", List.of()))).isEqualTo(AttributeDataType.ENUM);
        assertThat(VerbConfigDeriver.attributeType(arg("lookup", null))).isEqualTo(AttributeDataType.STRING);
        assertThat(VerbConfigDeriver.attributeType(arg(null, null))).isEqualTo(AttributeDataType.STRING);
    }

    @Test
    void derive_null_설정이면_예외() {
        assertThatThrownBy(() -> deriver.derive(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ArgConfig arg(String type, List<String> validValues) {
        return new ArgConfig("x", type, false, null, null, validValues, null, null);
    }

    private static <T extends Definition> T find(List<T> items, String fqn) {
        return items.stream().filter(item -> item.fqn().equals(fqn)).findFirst().orElseThrow();
    }
}
