package org.huang.origin.registry.rest;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.huang.origin.api.build.BuildConfig;
import org.huang.origin.api.build.BuildTriggerPolicy;
import org.huang.origin.api.route.Route;
import org.huang.origin.api.route.RouteTargetReference;
import org.huang.origin.api.validation.FieldError;
import org.huang.origin.api.validation.FieldPath;
import org.huang.origin.registry.buildconfig.BuildConfigStrategy;
import org.huang.origin.registry.errors.ResourceTypeMismatchException;
import org.huang.origin.registry.route.RouteStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class LifecycleHooksTest {

    @Mock
    private LifecycleStrategy<Route> strategy;

    @Test
    void testCreateOrder() {
        Route route = createRoute("frontend");
        when(strategy.cast(route)).thenReturn(route);
        when(strategy.namespaceScoped()).thenReturn(true);
        when(strategy.validate(route)).thenReturn(List.of());

        List<FieldError> errors = LifecycleHooks.beforeCreate(strategy, route);

        assertThat(errors).isEmpty();
        InOrder order = inOrder(strategy);
        order.verify(strategy).prepareForCreate(route);
        order.verify(strategy).validate(route);
        order.verify(strategy).canonicalize(route);
    }

    @Test
    void testCreateSkipsCanonicalizeWhenInvalid() {
        Route route = createRoute("frontend");
        FieldError error = FieldError.required(FieldPath.root("spec", "to"), "");
        when(strategy.cast(route)).thenReturn(route);
        when(strategy.namespaceScoped()).thenReturn(true);
        when(strategy.validate(route)).thenReturn(List.of(error));

        assertThat(LifecycleHooks.beforeCreate(strategy, route)).containsExactly(error);
        verify(strategy, never()).canonicalize(any());
    }

    @Test
    void testUpdateOrder() {
        Route old = createRoute("frontend");
        old.getSpec().setHost("old.example.com");
        Route route = createRoute("frontend");
        when(strategy.cast(route)).thenReturn(route);
        when(strategy.cast(old)).thenReturn(old);
        when(strategy.namespaceScoped()).thenReturn(true);
        when(strategy.validateUpdate(route, old)).thenReturn(List.of());

        assertThat(LifecycleHooks.beforeUpdate(strategy, route, old)).isEmpty();

        InOrder order = inOrder(strategy);
        order.verify(strategy).prepareForUpdate(route, old);
        order.verify(strategy).validateUpdate(route, old);
        order.verify(strategy).canonicalize(route);
        verify(strategy, never()).prepareForCreate(any());
    }

    @Test
    void testCreateGeneratesName() {
        Route route = createRoute(null);
        route.getMetadata().setGenerateName("frontend-");

        List<FieldError> errors = LifecycleHooks.beforeCreate(new RouteStrategy(null), route);

        assertThat(errors).isEmpty();
        assertThat(route.getMetadata().getName()).startsWith("frontend-").hasSize("frontend-".length() + 5);
    }

    @Test
    void testCreateClearsDeletionFields() {
        Route route = createRoute("frontend");
        route.getMetadata().setDeletionTimestamp("2024-01-01T00:00:00Z");
        route.getMetadata().setDeletionGracePeriodSeconds(30L);

        LifecycleHooks.beforeCreate(new RouteStrategy(null), route);

        assertThat(route.getMetadata().getDeletionTimestamp()).isNull();
        assertThat(route.getMetadata().getDeletionGracePeriodSeconds()).isNull();
    }

    @Test
    void testCreateReturnsValidationErrors() {
        Route route = createRoute("frontend");
        route.getSpec().setTo(null);

        List<FieldError> errors = LifecycleHooks.beforeCreate(new RouteStrategy(null), route);

        assertThat(errors).extracting(FieldError::getField).containsExactly("spec.to");
    }

    @Test
    void testBuildConfigCreateThenUpdate() {
        BuildConfig config = new BuildConfig();
        config.setMetadata(new ObjectMetaBuilder().withName("ruby-sample").withNamespace("demo").build());
        config.getSpec().getTriggers().add(BuildTriggerPolicy.ofType("ConfigChange"));
        config.getSpec().getTriggers().add(BuildTriggerPolicy.ofType("BogusType"));
        config.getStatus().setLastVersion(5);

        assertThat(LifecycleHooks.beforeCreate(BuildConfigStrategy.STRATEGY, config)).isEmpty();
        assertThat(config.getSpec().getTriggers()).extracting(BuildTriggerPolicy::getType)
                .containsExactly("ConfigChange");

        BuildConfig update = new BuildConfig();
        update.setMetadata(new ObjectMetaBuilder().withName("ruby-sample").withNamespace("demo").build());
        update.getStatus().setLastVersion(3);

        assertThat(LifecycleHooks.beforeUpdate(BuildConfigStrategy.STRATEGY, update, config)).isEmpty();
        assertThat(update.getStatus().getLastVersion()).isEqualTo(5);
    }

    @Test
    void testWrongKindIsRejected() {
        BuildConfig config = new BuildConfig();
        assertThatThrownBy(() -> LifecycleHooks.beforeCreate(new RouteStrategy(null), config))
                .isInstanceOf(ResourceTypeMismatchException.class)
                .hasMessage("not a Route");
        assertThatThrownBy(() -> LifecycleHooks.beforeUpdate(BuildConfigStrategy.STRATEGY, config, new Route()))
                .isInstanceOf(ResourceTypeMismatchException.class)
                .hasMessage("not a BuildConfig");
    }

    static Route createRoute(String name) {
        Route route = new Route();
        route.setMetadata(new ObjectMetaBuilder().withName(name).withNamespace("demo").build());
        route.getSpec().setTo(RouteTargetReference.service("frontend"));
        return route;
    }
}
