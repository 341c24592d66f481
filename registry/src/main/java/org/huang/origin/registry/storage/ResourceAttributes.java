package org.huang.origin.registry.storage;

import lombok.Value;

import java.util.Map;

/**
 * 资源用于筛选的两组属性：标签和可索引字段
 */
@Value
public class ResourceAttributes {

    Map<String, String> labels;

    Map<String, String> fields;

    public static ResourceAttributes of(Map<String, String> labels, Map<String, String> fields) {
        return new ResourceAttributes(
                labels == null ? Map.of() : Map.copyOf(labels),
                fields == null ? Map.of() : Map.copyOf(fields));
    }
}
