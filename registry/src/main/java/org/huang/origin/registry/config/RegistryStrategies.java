package org.huang.origin.registry.config;

import lombok.extern.slf4j.Slf4j;
import org.huang.origin.api.route.validation.DefaultRouteValidator;
import org.huang.origin.registry.buildconfig.BuildConfigStrategy;
import org.huang.origin.registry.errors.ErrorReporter;
import org.huang.origin.registry.errors.ErrorReporters;
import org.huang.origin.registry.rest.SimpleNameGenerator;
import org.huang.origin.registry.route.RouteStatusStrategy;
import org.huang.origin.registry.route.RouteStrategy;
import org.huang.origin.registry.route.allocation.RouteAllocationController;
import org.huang.origin.registry.route.allocation.RouteAllocator;
import org.huang.origin.registry.route.allocation.SimpleAllocationPlugin;

/**
 * 启动时按配置创建的一组策略，之后只读
 */
@Slf4j
public final class RegistryStrategies {

    private final BuildConfigStrategy buildConfigStrategy;
    private final RouteStrategy routeStrategy;
    private final RouteStatusStrategy routeStatusStrategy;

    private RegistryStrategies(BuildConfigStrategy buildConfigStrategy, RouteStrategy routeStrategy,
                               RouteStatusStrategy routeStatusStrategy) {
        this.buildConfigStrategy = buildConfigStrategy;
        this.routeStrategy = routeStrategy;
        this.routeStatusStrategy = routeStatusStrategy;
    }

    public static RegistryStrategies create(RegistryConfig config) {
        return create(config, ErrorReporters.delegatingToDefault());
    }

    public static RegistryStrategies create(RegistryConfig config, ErrorReporter errorReporter) {
        RouteAllocator allocator = null;
        if (config.isRouteHostAllocation()) {
            allocator = new RouteAllocationController(new SimpleAllocationPlugin(config.getRouterSubdomain()));
        }
        log.info("Route host allocation {}",
                allocator == null ? "disabled" : "enabled with subdomain " + config.getRouterSubdomain());

        RouteStrategy routeStrategy = new RouteStrategy(allocator, DefaultRouteValidator.INSTANCE, errorReporter,
                SimpleNameGenerator.INSTANCE);
        // status 路径从不分配主机名
        RouteStatusStrategy statusStrategy = new RouteStatusStrategy(new RouteStrategy(null,
                DefaultRouteValidator.INSTANCE, errorReporter, SimpleNameGenerator.INSTANCE));
        return new RegistryStrategies(BuildConfigStrategy.STRATEGY, routeStrategy, statusStrategy);
    }

    public BuildConfigStrategy getBuildConfigStrategy() {
        return buildConfigStrategy;
    }

    public RouteStrategy getRouteStrategy() {
        return routeStrategy;
    }

    public RouteStatusStrategy getRouteStatusStrategy() {
        return routeStatusStrategy;
    }
}
