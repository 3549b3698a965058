package com.ryuqq.semreg.core.definition;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ViewDefBody 컬럼 병합 테스트.
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
class ViewDefBodyTest {

    private final ViewDefBody view = new ViewDefBody(
        "view.test", "Test View", null, "test", "entity.base",
        List.of(new ViewColumn("test.existing", "Existing", "entity.base")),
        null, null
    );

    @Test
    void mergeColumns_새_컬럼만_뒤에_추가() {
        // when
        ViewDefBody merged = view.mergeColumns(List.of(
            new ViewColumn("test.existing", "Existing Again", "entity.test-widget"),
            new ViewColumn("test.widget-name", "Widget Name", "entity.test-widget")
        ));

        // then
        assertThat(merged).isNotSameAs(view);
        assertThat(merged.columns()).extracting(ViewColumn::attributeFqn)
            .containsExactly("test.existing", "test.widget-name");
        assertThat(merged.columns().get(0).label()).isEqualTo("Existing");
    }

    @Test
    void mergeColumns_추가할_컬럼이_없으면_같은_인스턴스() {
        // when
        ViewDefBody merged = view.mergeColumns(List.of(new ViewColumn("test.existing", "E", null)));

        // then
        assertThat(merged).isSameAs(view);
    }

    @Test
    void containsColumn_속성_FQN으로_판단() {
        assertThat(view.containsColumn("test.existing")).isTrue();
        assertThat(view.containsColumn("test.other")).isFalse();
    }

    @Test
    void ViewColumn_빈_속성_FQN_거부() {
        assertThatThrownBy(() -> new ViewColumn(" ", "Label", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
