package org.huang.origin.registry.storage;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorBuilder;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LabelSelectorsTest {

    private static final Map<String, String> LABELS = Map.of("app", "frontend", "tier", "web");

    @Test
    void testNullMatchesEverything() {
        assertThat(LabelSelectors.isEmpty(null)).isTrue();
        assertThat(LabelSelectors.matches(null, LABELS)).isTrue();
        assertThat(LabelSelectors.matches(new LabelSelector(), null)).isTrue();
    }

    @Test
    void testMatchLabels() {
        LabelSelector selector = new LabelSelectorBuilder().addToMatchLabels("app", "frontend").build();
        assertThat(LabelSelectors.matches(selector, LABELS)).isTrue();
        assertThat(LabelSelectors.matches(selector, Map.of("app", "backend"))).isFalse();
        assertThat(LabelSelectors.matches(selector, Map.of())).isFalse();
    }

    @Test
    void testMatchExpressions() {
        assertThat(matches("app", "In", List.of("frontend", "backend"))).isTrue();
        assertThat(matches("app", "NotIn", List.of("frontend"))).isFalse();
        assertThat(matches("release", "NotIn", List.of("canary"))).isTrue();
        assertThat(matches("tier", "Exists", null)).isTrue();
        assertThat(matches("tier", "DoesNotExist", null)).isFalse();
        assertThat(matches("release", "DoesNotExist", null)).isTrue();
    }

    @Test
    void testUnsupportedOperator() {
        assertThatThrownBy(() -> matches("app", "Gt", List.of("1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static boolean matches(String key, String operator, List<String> values) {
        LabelSelector selector = new LabelSelectorBuilder()
                .withMatchExpressions(new LabelSelectorRequirement(key, operator, values))
                .build();
        return LabelSelectors.matches(selector, LABELS);
    }
}
