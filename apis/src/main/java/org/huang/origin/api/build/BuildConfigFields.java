package org.huang.origin.api.build;

import org.huang.origin.api.fields.ObjectMetaFields;

import java.util.Map;

public final class BuildConfigFields {

    private BuildConfigFields() {
    }

    /**
     * BuildConfig 可用于 field selector 的字段
     */
    public static Map<String, String> toSelectableFields(BuildConfig config) {
        return ObjectMetaFields.objectMetaFieldsSet(config.getMetadata(), true);
    }
}
