package org.huang.origin.api.route.validation;

import org.huang.origin.api.route.Route;
import org.huang.origin.api.route.RouteIngress;
import org.huang.origin.api.route.RouteIngressCondition;
import org.huang.origin.api.route.RouteSpec;
import org.huang.origin.api.route.RouteStatus;
import org.huang.origin.api.route.RouteTargetReference;
import org.huang.origin.api.route.TLSConfig;
import org.huang.origin.api.route.WildcardPolicy;
import org.huang.origin.api.validation.FieldError;
import org.huang.origin.api.validation.FieldPath;
import org.huang.origin.api.validation.NameValidation;
import org.huang.origin.api.validation.ObjectMetaValidation;

import java.util.ArrayList;
import java.util.List;

public class DefaultRouteValidator implements RouteValidator {

    public static final DefaultRouteValidator INSTANCE = new DefaultRouteValidator();

    static final int MAX_ALTERNATE_BACKENDS = 3;
    static final int MAX_WEIGHT = 256;

    @Override
    public List<FieldError> validateRoute(Route route) {
        List<FieldError> errors = new ArrayList<>(
                ObjectMetaValidation.validateObjectMeta(route.getMetadata(), true, FieldPath.root("metadata")));

        FieldPath specPath = FieldPath.root("spec");
        RouteSpec spec = route.getSpec();
        if (spec == null) {
            errors.add(FieldError.required(specPath, ""));
            return errors;
        }

        String host = spec.getHost();
        boolean hasHost = host != null && !host.isEmpty();
        if (hasHost && !NameValidation.isDns1123Subdomain(host)) {
            errors.add(FieldError.invalid(specPath.child("host"), host, NameValidation.DNS1123_SUBDOMAIN_MESSAGE));
        }
        if (spec.getWildcardPolicy() == WildcardPolicy.SUBDOMAIN && !hasHost) {
            errors.add(FieldError.invalid(specPath.child("wildcardPolicy"), spec.getWildcardPolicy().getValue(),
                    "host name not specified for wildcard policy"));
        }

        String path = spec.getPath();
        if (path != null && !path.isEmpty() && !path.startsWith("/")) {
            errors.add(FieldError.invalid(specPath.child("path"), path, "path must begin with /"));
        }

        if (spec.getTo() == null) {
            errors.add(FieldError.required(specPath.child("to"), ""));
        } else {
            errors.addAll(validateTarget(spec.getTo(), specPath.child("to")));
        }

        List<RouteTargetReference> backends = spec.getAlternateBackends();
        if (backends != null) {
            if (backends.size() > MAX_ALTERNATE_BACKENDS) {
                errors.add(FieldError.invalid(specPath.child("alternateBackends"), backends.size(),
                        "cannot specify more than " + MAX_ALTERNATE_BACKENDS + " alternate backends"));
            }
            for (int i = 0; i < backends.size(); i++) {
                errors.addAll(validateTarget(backends.get(i), specPath.child("alternateBackends").index(i)));
            }
        }

        if (spec.getPort() != null
                && (spec.getPort().getTargetPort() == null || spec.getPort().getTargetPort().isEmpty())) {
            errors.add(FieldError.required(specPath.child("port", "targetPort"), ""));
        }

        if (spec.getTls() != null) {
            errors.addAll(validateTls(spec, specPath.child("tls")));
        }
        return errors;
    }

    @Override
    public List<FieldError> validateRouteUpdate(Route route, Route old) {
        List<FieldError> errors = new ArrayList<>(ObjectMetaValidation.validateObjectMetaUpdate(
                route.getMetadata(), old.getMetadata(), FieldPath.root("metadata")));
        errors.addAll(validateRoute(route));
        return errors;
    }

    @Override
    public List<FieldError> validateRouteStatusUpdate(Route route, Route old) {
        List<FieldError> errors = new ArrayList<>(ObjectMetaValidation.validateObjectMetaUpdate(
                route.getMetadata(), old.getMetadata(), FieldPath.root("metadata")));
        RouteStatus status = route.getStatus();
        if (status == null || status.getIngress() == null) {
            return errors;
        }
        FieldPath ingressPath = FieldPath.root("status", "ingress");
        for (int i = 0; i < status.getIngress().size(); i++) {
            RouteIngress ingress = status.getIngress().get(i);
            FieldPath path = ingressPath.index(i);
            if (ingress.getHost() == null || ingress.getHost().isEmpty()) {
                errors.add(FieldError.required(path.child("host"), ""));
            }
            if (ingress.getRouterName() == null || ingress.getRouterName().isEmpty()) {
                errors.add(FieldError.required(path.child("routerName"), ""));
            }
            if (ingress.getConditions() != null) {
                for (int j = 0; j < ingress.getConditions().size(); j++) {
                    RouteIngressCondition condition = ingress.getConditions().get(j);
                    if (condition.getType() == null || condition.getType().isEmpty()) {
                        errors.add(FieldError.required(path.child("conditions").index(j).child("type"), ""));
                    }
                }
            }
        }
        return errors;
    }

    private List<FieldError> validateTarget(RouteTargetReference target, FieldPath path) {
        List<FieldError> errors = new ArrayList<>();
        if (target.getName() == null || target.getName().isEmpty()) {
            errors.add(FieldError.required(path.child("name"), ""));
        }
        String kind = target.getKind();
        if (kind != null && !kind.isEmpty() && !RouteTargetReference.KIND_SERVICE.equals(kind)) {
            errors.add(FieldError.invalid(path.child("kind"), kind, "must reference a Service"));
        }
        Integer weight = target.getWeight();
        if (weight != null && (weight < 0 || weight > MAX_WEIGHT)) {
            errors.add(FieldError.invalid(path.child("weight"), weight,
                    "weight must be an integer between 0 and " + MAX_WEIGHT));
        }
        return errors;
    }

    private List<FieldError> validateTls(RouteSpec spec, FieldPath path) {
        List<FieldError> errors = new ArrayList<>();
        TLSConfig tls = spec.getTls();
        String termination = tls.getTermination();
        if (termination == null || termination.isEmpty()) {
            errors.add(FieldError.required(path.child("termination"), ""));
        } else if (!TLSConfig.TERMINATION_TYPES.contains(termination)) {
            errors.add(FieldError.notSupported(path.child("termination"), termination, TLSConfig.TERMINATION_TYPES));
        }

        if (TLSConfig.TERMINATION_PASSTHROUGH.equals(termination)) {
            if (spec.getPath() != null && !spec.getPath().isEmpty()) {
                errors.add(FieldError.invalid(FieldPath.root("spec", "path"), spec.getPath(),
                        "passthrough termination does not support paths"));
            }
            if (notEmpty(tls.getCertificate()) || notEmpty(tls.getKey())) {
                errors.add(FieldError.invalid(path, termination,
                        "passthrough termination does not support certificates"));
            }
        }

        String insecure = tls.getInsecureEdgeTerminationPolicy();
        if (notEmpty(insecure) && !TLSConfig.INSECURE_POLICIES.contains(insecure)) {
            errors.add(FieldError.notSupported(path.child("insecureEdgeTerminationPolicy"), insecure,
                    TLSConfig.INSECURE_POLICIES));
        }
        return errors;
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
