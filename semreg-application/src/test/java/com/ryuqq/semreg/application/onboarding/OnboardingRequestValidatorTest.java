package com.ryuqq.semreg.application.onboarding;

import com.ryuqq.semreg.core.definition.AttributeDefBody;
import com.ryuqq.semreg.core.definition.EntityTypeDefBody;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OnboardingRequestValidator 유닛 테스트.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
class OnboardingRequestValidatorTest {

    private final OnboardingRequestValidator validator = new OnboardingRequestValidator();

    @Test
    void validate_정상_요청은_통과() {
        // given
        OnboardingRequest request = OnboardingRequest.builder(entity("entity.test-widget"))
            .attribute(attribute("test.widget-name"))
            .taxonomyFqn("taxonomy.test")
            .viewFqn("view.test")
            .build();

        // when & then
        assertThatCode(() -> validator.validate(request)).doesNotThrowAnyException();
    }

    @Test
    void validate_entity_type이_없으면_예외() {
        // given
        OnboardingRequest request = OnboardingRequest.builder(null).build();

        // when & then
        assertThatThrownBy(() -> validator.validate(request))
            .isInstanceOf(OnboardingValidationException.class)
            .hasMessageContaining("entity_type is required");
    }

    @Test
    void validate_모든_위반을_한_번에_보고() {
        // given
        EntityTypeDefBody entity = new EntityTypeDefBody("no-dot", "", "desc", null, null, null, null, null, null);
        OnboardingRequest request = OnboardingRequest.builder(entity)
            .createdBy(" ")
            .build();

        // when & then
        assertThatThrownBy(() -> validator.validate(request))
            .isInstanceOfSatisfying(OnboardingValidationException.class, e -> assertThat(e.getViolations())
                .containsExactly(
                    "entity_type.fqn is not a valid FQN: 'no-dot'",
                    "entity_type.name is required",
                    "entity_type.domain is required",
                    "created_by is required"
                ));
    }

    @Test
    void validate_속성_FQN_중복이면_예외() {
        // given
        OnboardingRequest request = OnboardingRequest.builder(entity("entity.test-widget"))
            .attribute(attribute("test.widget-name"))
            .attribute(attribute("test.widget-name"))
            .build();

        // when & then
        assertThatThrownBy(() -> validator.validate(request))
            .isInstanceOf(OnboardingValidationException.class)
            .hasMessageContaining("attributes[1].fqn duplicates 'test.widget-name'");
    }

    @Test
    void validate_필수와_선택_속성에_같은_FQN이_있으면_예외() {
        // given
        EntityTypeDefBody entity = entity("entity.test-gadget").withAttributes(
            List.of("test.gadget-name"),
            List.of("test.gadget-name")
        );

        // when & then
        assertThatThrownBy(() -> validator.validate(OnboardingRequest.builder(entity).build()))
            .isInstanceOfSatisfying(OnboardingValidationException.class, e -> assertThat(e.getViolations())
                .containsExactly("entity_type.optional_attributes[0] duplicates 'test.gadget-name'"));
    }

    @Test
    void validate_엔티티_속성_목록의_중복과_잘못된_FQN을_모두_보고() {
        // given
        EntityTypeDefBody entity = entity("entity.test-gadget").withAttributes(
            List.of("test.gadget-name", "test.gadget-name", " "),
            List.of("gadget-colour")
        );

        // when & then
        assertThatThrownBy(() -> validator.validate(OnboardingRequest.builder(entity).build()))
            .isInstanceOfSatisfying(OnboardingValidationException.class, e -> assertThat(e.getViolations())
                .containsExactly(
                    "entity_type.required_attributes[1] duplicates 'test.gadget-name'",
                    "entity_type.required_attributes[2] is required",
                    "entity_type.optional_attributes[0] is not a valid FQN: 'gadget-colour'"
                ));
    }

    @Test
    void validate_빈_뷰_FQN이면_예외() {
        // given
        OnboardingRequest request = OnboardingRequest.builder(entity("entity.test-widget"))
            .viewFqn("")
            .build();

        // when & then
        assertThatThrownBy(() -> validator.validate(request))
            .isInstanceOf(OnboardingValidationException.class)
            .hasMessageContaining("view_fqns[0] is required");
    }

    @Test
    void validate_OnboardingValidationException은_IllegalArgumentException() {
        // given
        OnboardingRequest request = OnboardingRequest.builder(null).build();

        // when & then
        assertThatThrownBy(() -> validator.validate(request))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validate_request가_null이면_예외() {
        assertThatThrownBy(() -> validator.validate(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("request cannot be null");
    }

    private static EntityTypeDefBody entity(String fqn) {
        return EntityTypeDefBody.of(fqn, "Test Widget", "A test widget", "test");
    }

    private static AttributeDefBody attribute(String fqn) {
        return new AttributeDefBody(fqn, "Name", "desc", "test", null, null, null, false, null);
    }
}
