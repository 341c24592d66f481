package org.huang.origin.registry.rest;

import io.fabric8.kubernetes.api.model.DeleteOptions;
import io.fabric8.kubernetes.api.model.HasMetadata;
import org.huang.origin.api.validation.FieldError;
import org.huang.origin.registry.errors.ResourceTypeMismatchException;

import java.util.List;

/**
 * 一种资源在创建、更新、删除时的处理策略。<br/>
 * 调用顺序由外部的请求处理流程决定，策略自己不会调用这些钩子：
 * <ul>
 *     <li>创建：prepareForCreate → validate → (校验通过) canonicalize</li>
 *     <li>更新：prepareForUpdate → validateUpdate → (校验通过) canonicalize</li>
 * </ul>
 * 实现类在进程启动时创建一次，之后只读，可以被并发请求共享。
 *
 * @param <T> 资源类型
 */
public interface LifecycleStrategy<T extends HasMetadata> extends NameGenerator {

    /**
     * 策略处理的资源类型
     */
    Class<T> resourceType();

    /**
     * 资源是否属于某个命名空间
     */
    boolean namespaceScoped();

    /**
     * 更新一个不存在的对象时能否直接创建
     */
    boolean allowCreateOnUpdate();

    /**
     * 更新能否跳过 resourceVersion 的乐观锁检查
     */
    boolean allowUnconditionalUpdate();

    /**
     * 创建前原地清理客户端不允许设置的字段。对已经处理过的对象再调用一次不应产生变化。
     */
    void prepareForCreate(T obj);

    /**
     * 更新前原地修正 obj，old 是已持久化的旧对象，用来保证不可变字段和单调字段
     */
    void prepareForUpdate(T obj, T old);

    /**
     * 创建校验，不修改 obj
     */
    List<FieldError> validate(T obj);

    /**
     * 更新校验，不修改 obj 和 old
     */
    List<FieldError> validateUpdate(T obj, T old);

    /**
     * 校验通过后的规范化
     */
    void canonicalize(T obj);

    /**
     * 是否允许延迟（优雅）删除
     */
    boolean checkGracefulDelete(T obj, DeleteOptions options);

    /**
     * 把外部传入的对象转换为策略的资源类型
     *
     * @throws ResourceTypeMismatchException 类型不符
     */
    default T cast(HasMetadata obj) {
        Class<T> type = resourceType();
        if (!type.isInstance(obj)) {
            throw new ResourceTypeMismatchException("not a " + type.getSimpleName());
        }
        return type.cast(obj);
    }
}
