package org.huang.origin.registry.storage;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.LabelSelector;
import org.huang.origin.api.fields.ObjectMetaFields;
import org.huang.origin.registry.errors.ResourceTypeMismatchException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * list / watch 查询使用的筛选条件：标签选择器 + 字段选择器 + 属性提取函数。无状态，不缓存。
 */
public final class SelectionPredicate {

    private final LabelSelector label;
    private final FieldSelector field;
    private final AttrFunc attrFunc;

    public SelectionPredicate(LabelSelector label, FieldSelector field, AttrFunc attrFunc) {
        this.label = label;
        this.field = field == null ? FieldSelector.everything() : field;
        this.attrFunc = Objects.requireNonNull(attrFunc, "attrFunc");
    }

    public LabelSelector getLabel() {
        return label;
    }

    public FieldSelector getField() {
        return field;
    }

    public boolean empty() {
        return LabelSelectors.isEmpty(label) && field.isEmpty();
    }

    /**
     * @throws ResourceTypeMismatchException 属性提取函数不接受该对象
     */
    public boolean matches(HasMetadata obj) {
        if (empty()) {
            return true;
        }
        ResourceAttributes attrs = attrFunc.getAttrs(obj);
        return matchesObjectAttributes(attrs);
    }

    public boolean matchesObjectAttributes(ResourceAttributes attrs) {
        return LabelSelectors.matches(label, attrs.getLabels()) && field.matches(attrs.getFields());
    }

    /**
     * 字段选择器按名称精确匹配时返回该名称，存储层可以直接按 key 读取单个对象
     */
    public Optional<String> matchesSingle() {
        return field.requiresExactMatch(ObjectMetaFields.NAME);
    }

    public <T extends HasMetadata> List<T> filter(List<T> objects) {
        if (empty()) {
            return objects;
        }
        return objects.stream().filter(this::matches).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "SelectionPredicate{label=" + label + ", field=" + field + '}';
    }
}
