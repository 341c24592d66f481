package org.huang.origin.registry.storage;

import io.fabric8.kubernetes.api.model.HasMetadata;
import org.huang.origin.registry.errors.ResourceTypeMismatchException;

@FunctionalInterface
public interface AttrFunc {

    /**
     * @throws ResourceTypeMismatchException obj 不是期望的资源类型
     */
    ResourceAttributes getAttrs(HasMetadata obj);
}
