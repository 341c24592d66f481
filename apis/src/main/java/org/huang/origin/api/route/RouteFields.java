package org.huang.origin.api.route;

import org.huang.origin.api.fields.ObjectMetaFields;

import java.util.Map;

import static org.huang.origin.api.fields.ObjectMetaFields.nullToEmpty;

public final class RouteFields {

    public static final String SPEC_PATH = "spec.path";
    public static final String SPEC_HOST = "spec.host";
    public static final String SPEC_TO_NAME = "spec.to.name";

    private RouteFields() {
    }

    /**
     * Route 可用于 field selector 的字段，包括 metadata 字段和 spec.path / spec.host / spec.to.name
     */
    public static Map<String, String> toSelectableFields(Route route) {
        Map<String, String> fields = ObjectMetaFields.objectMetaFieldsSet(route.getMetadata(), true);
        RouteSpec spec = route.getSpec();
        fields.put(SPEC_PATH, spec == null ? "" : nullToEmpty(spec.getPath()));
        fields.put(SPEC_HOST, spec == null ? "" : nullToEmpty(spec.getHost()));
        fields.put(SPEC_TO_NAME,
                spec == null || spec.getTo() == null ? "" : nullToEmpty(spec.getTo().getName()));
        return fields;
    }
}
