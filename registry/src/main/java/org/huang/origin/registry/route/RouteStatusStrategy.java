package org.huang.origin.registry.route;

import io.fabric8.kubernetes.api.model.DeleteOptions;
import org.huang.origin.api.route.Route;
import org.huang.origin.api.route.RouteSpec;
import org.huang.origin.api.route.validation.RouteValidator;
import org.huang.origin.api.validation.FieldError;
import org.huang.origin.registry.rest.LifecycleStrategy;

import java.util.List;

/**
 * routes/status 子资源的更新逻辑。<br/>
 * 组合一个不带分配器的 {@link RouteStrategy}，只改写 prepareForUpdate 和 validateUpdate：
 * 通过 status 路径的更新只能修改 status，spec 总是恢复为旧值。
 */
public class RouteStatusStrategy implements LifecycleStrategy<Route> {

    public static final RouteStatusStrategy STATUS_STRATEGY = new RouteStatusStrategy(new RouteStrategy(null));

    private final RouteStrategy routeStrategy;

    public RouteStatusStrategy(RouteStrategy routeStrategy) {
        this.routeStrategy = routeStrategy;
    }

    @Override
    public void prepareForUpdate(Route route, Route old) {
        route.setSpec(RouteStrategy.deepCopy(old.getSpec(), RouteSpec.class));
    }

    @Override
    public List<FieldError> validateUpdate(Route route, Route old) {
        RouteValidator validator = routeStrategy.getValidator();
        return validator.validateRouteStatusUpdate(route, old);
    }

    @Override
    public Class<Route> resourceType() {
        return routeStrategy.resourceType();
    }

    @Override
    public String generateName(String base) {
        return routeStrategy.generateName(base);
    }

    @Override
    public boolean namespaceScoped() {
        return routeStrategy.namespaceScoped();
    }

    @Override
    public boolean allowCreateOnUpdate() {
        return routeStrategy.allowCreateOnUpdate();
    }

    @Override
    public boolean allowUnconditionalUpdate() {
        return routeStrategy.allowUnconditionalUpdate();
    }

    @Override
    public void prepareForCreate(Route route) {
        routeStrategy.prepareForCreate(route);
    }

    @Override
    public List<FieldError> validate(Route route) {
        return routeStrategy.validate(route);
    }

    @Override
    public void canonicalize(Route route) {
        routeStrategy.canonicalize(route);
    }

    @Override
    public boolean checkGracefulDelete(Route route, DeleteOptions options) {
        return routeStrategy.checkGracefulDelete(route, options);
    }
}
