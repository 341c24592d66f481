package org.huang.origin.registry.rest;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import lombok.extern.slf4j.Slf4j;
import org.huang.origin.api.validation.FieldError;
import org.huang.origin.registry.errors.ResourceTypeMismatchException;

import java.util.List;

/**
 * 请求处理流程中调用策略钩子的固定顺序。持久化之前调用，返回的错误列表非空时不能写入存储。
 */
@Slf4j
public final class LifecycleHooks {

    private LifecycleHooks() {
    }

    /**
     * 创建前处理：prepareForCreate → 生成名称 → validate → canonicalize
     *
     * @throws ResourceTypeMismatchException obj 不是策略处理的类型
     */
    public static <T extends HasMetadata> List<FieldError> beforeCreate(LifecycleStrategy<T> strategy,
                                                                        HasMetadata obj) {
        T resource = strategy.cast(obj);
        ObjectMeta meta = ensureMetadata(resource);
        if (!strategy.namespaceScoped()) {
            meta.setNamespace(null);
        }
        meta.setDeletionTimestamp(null);
        meta.setDeletionGracePeriodSeconds(null);

        strategy.prepareForCreate(resource);

        if (isEmpty(meta.getName()) && !isEmpty(meta.getGenerateName())) {
            meta.setName(strategy.generateName(meta.getGenerateName()));
        }

        List<FieldError> errors = strategy.validate(resource);
        if (!errors.isEmpty()) {
            log.debug("{} {} rejected on create: {}", resource.getKind(), meta.getName(), errors);
            return errors;
        }
        strategy.canonicalize(resource);
        return errors;
    }

    /**
     * 更新前处理：prepareForUpdate → validateUpdate → canonicalize
     *
     * @throws ResourceTypeMismatchException obj 或 old 不是策略处理的类型
     */
    public static <T extends HasMetadata> List<FieldError> beforeUpdate(LifecycleStrategy<T> strategy,
                                                                        HasMetadata obj, HasMetadata old) {
        T resource = strategy.cast(obj);
        T oldResource = strategy.cast(old);
        ObjectMeta meta = ensureMetadata(resource);
        if (!strategy.namespaceScoped()) {
            meta.setNamespace(null);
        }

        strategy.prepareForUpdate(resource, oldResource);

        List<FieldError> errors = strategy.validateUpdate(resource, oldResource);
        if (!errors.isEmpty()) {
            log.debug("{} {} rejected on update: {}", resource.getKind(), meta.getName(), errors);
            return errors;
        }
        strategy.canonicalize(resource);
        return errors;
    }

    private static ObjectMeta ensureMetadata(HasMetadata resource) {
        if (resource.getMetadata() == null) {
            resource.setMetadata(new ObjectMeta());
        }
        return resource.getMetadata();
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
