package org.huang.origin.api.build;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class BuildTriggerTypesTest {

    @Test
    void testKnownTypes() {
        assertThat(BuildTriggerTypes.isKnown("Generic")).isTrue();
        assertThat(BuildTriggerTypes.isKnown("ImageChange")).isTrue();
        assertThat(BuildTriggerTypes.isKnown("BogusType")).isFalse();
        assertThat(BuildTriggerTypes.isKnown("generic")).isFalse();
        assertThat(BuildTriggerTypes.isKnown(null)).isFalse();
    }

    @Test
    void testSelectableFields() {
        BuildConfig config = new BuildConfig();
        config.setMetadata(new ObjectMetaBuilder().withName("ruby-sample").withNamespace("demo").build());
        assertThat(BuildConfigFields.toSelectableFields(config))
                .containsOnlyKeys("metadata.name", "metadata.namespace")
                .containsEntry("metadata.name", "ruby-sample");
    }
}
