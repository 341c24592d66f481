package org.huang.origin.api.route;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class RouteFieldsTest {

    @Test
    void testSelectableFields() {
        Route route = new Route();
        route.setMetadata(new ObjectMetaBuilder().withName("frontend").withNamespace("demo").build());
        route.getSpec().setHost("www.example.com");
        route.getSpec().setTo(RouteTargetReference.service("frontend-svc"));

        Map<String, String> fields = RouteFields.toSelectableFields(route);
        assertThat(fields).containsExactly(
                Map.entry("metadata.name", "frontend"),
                Map.entry("metadata.namespace", "demo"),
                Map.entry("spec.path", ""),
                Map.entry("spec.host", "www.example.com"),
                Map.entry("spec.to.name", "frontend-svc"));
    }

    @Test
    void testMissingTarget() {
        Route route = new Route();
        route.setMetadata(new ObjectMetaBuilder().withName("frontend").withNamespace("demo").build());
        assertThat(RouteFields.toSelectableFields(route)).containsEntry("spec.to.name", "");
    }

    @Test
    void testWildcardPolicyValues() {
        assertThat(WildcardPolicy.fromValue("Subdomain")).isEqualTo(WildcardPolicy.SUBDOMAIN);
        assertThat(WildcardPolicy.fromValue("")).isEqualTo(WildcardPolicy.NONE);
        assertThat(WildcardPolicy.NONE.getValue()).isEqualTo("None");
    }
}
