package org.huang.origin.api.route.validation;

import org.huang.origin.api.route.Route;
import org.huang.origin.api.validation.FieldError;

import java.util.List;

/**
 * Route 的校验规则。status 更新走单独的 {@link #validateRouteStatusUpdate(Route, Route)}。
 */
public interface RouteValidator {

    List<FieldError> validateRoute(Route route);

    List<FieldError> validateRouteUpdate(Route route, Route old);

    List<FieldError> validateRouteStatusUpdate(Route route, Route old);
}
