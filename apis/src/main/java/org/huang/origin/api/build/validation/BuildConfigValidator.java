package org.huang.origin.api.build.validation;

import org.huang.origin.api.build.BuildConfig;
import org.huang.origin.api.validation.FieldError;

import java.util.List;

/**
 * BuildConfig 的校验规则。两个方法都不能修改入参，返回空列表表示通过。
 */
public interface BuildConfigValidator {

    List<FieldError> validateBuildConfig(BuildConfig config);

    List<FieldError> validateBuildConfigUpdate(BuildConfig config, BuildConfig old);
}
