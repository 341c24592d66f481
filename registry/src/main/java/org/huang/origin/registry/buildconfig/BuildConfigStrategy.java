package org.huang.origin.registry.buildconfig;

import io.fabric8.kubernetes.api.model.DeleteOptions;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.LabelSelector;
import lombok.extern.slf4j.Slf4j;
import org.huang.origin.api.build.BuildConfig;
import org.huang.origin.api.build.BuildConfigFields;
import org.huang.origin.api.build.BuildConfigSpec;
import org.huang.origin.api.build.BuildConfigStatus;
import org.huang.origin.api.build.BuildTriggerPolicy;
import org.huang.origin.api.build.BuildTriggerTypes;
import org.huang.origin.api.build.validation.BuildConfigValidator;
import org.huang.origin.api.build.validation.DefaultBuildConfigValidator;
import org.huang.origin.api.validation.FieldError;
import org.huang.origin.registry.errors.ResourceTypeMismatchException;
import org.huang.origin.registry.rest.LifecycleStrategy;
import org.huang.origin.registry.rest.NameGenerator;
import org.huang.origin.registry.rest.SimpleNameGenerator;
import org.huang.origin.registry.storage.FieldSelector;
import org.huang.origin.registry.storage.ResourceAttributes;
import org.huang.origin.registry.storage.SelectionPredicate;

import java.util.ArrayList;
import java.util.List;

/**
 * BuildConfig 的创建、更新逻辑：
 * <ul>
 *     <li>丢弃未知类型的触发规则，保留其余规则的原有顺序</li>
 *     <li>更新时 status.lastVersion 不能回退，回退的值直接用旧值覆盖，不作为校验错误</li>
 * </ul>
 */
@Slf4j
public class BuildConfigStrategy implements LifecycleStrategy<BuildConfig> {

    /**
     * 默认策略
     */
    public static final BuildConfigStrategy STRATEGY =
            new BuildConfigStrategy(DefaultBuildConfigValidator.INSTANCE, SimpleNameGenerator.INSTANCE);

    private final BuildConfigValidator validator;
    private final NameGenerator nameGenerator;

    public BuildConfigStrategy(BuildConfigValidator validator, NameGenerator nameGenerator) {
        this.validator = validator;
        this.nameGenerator = nameGenerator;
    }

    @Override
    public Class<BuildConfig> resourceType() {
        return BuildConfig.class;
    }

    @Override
    public String generateName(String base) {
        return nameGenerator.generateName(base);
    }

    @Override
    public boolean namespaceScoped() {
        return true;
    }

    @Override
    public boolean allowCreateOnUpdate() {
        return false;
    }

    @Override
    public boolean allowUnconditionalUpdate() {
        return false;
    }

    @Override
    public void prepareForCreate(BuildConfig config) {
        dropUnknownTriggers(config);
    }

    @Override
    public void prepareForUpdate(BuildConfig config, BuildConfig old) {
        dropUnknownTriggers(config);
        // 构建序号回退会和已存在的构建冲突
        long oldVersion = lastVersion(old);
        if (lastVersion(config) < oldVersion) {
            if (config.getStatus() == null) {
                config.setStatus(new BuildConfigStatus());
            }
            config.getStatus().setLastVersion(oldVersion);
        }
    }

    @Override
    public List<FieldError> validate(BuildConfig config) {
        return validator.validateBuildConfig(config);
    }

    @Override
    public List<FieldError> validateUpdate(BuildConfig config, BuildConfig old) {
        return validator.validateBuildConfigUpdate(config, old);
    }

    @Override
    public void canonicalize(BuildConfig config) {
    }

    @Override
    public boolean checkGracefulDelete(BuildConfig config, DeleteOptions options) {
        return false;
    }

    /**
     * 返回 BuildConfig 的标签和可筛选字段
     *
     * @throws ResourceTypeMismatchException obj 不是 BuildConfig
     */
    public static ResourceAttributes getAttrs(HasMetadata obj) {
        if (!(obj instanceof BuildConfig)) {
            throw new ResourceTypeMismatchException("not a BuildConfig");
        }
        BuildConfig config = (BuildConfig) obj;
        return ResourceAttributes.of(config.getMetadata().getLabels(), BuildConfigFields.toSelectableFields(config));
    }

    public static SelectionPredicate matcher(LabelSelector label, FieldSelector field) {
        return new SelectionPredicate(label, field, BuildConfigStrategy::getAttrs);
    }

    static void dropUnknownTriggers(BuildConfig config) {
        BuildConfigSpec spec = config.getSpec();
        if (spec == null || spec.getTriggers() == null) {
            return;
        }
        List<BuildTriggerPolicy> triggers = new ArrayList<>();
        for (BuildTriggerPolicy trigger : spec.getTriggers()) {
            if (trigger != null && BuildTriggerTypes.isKnown(trigger.getType())) {
                triggers.add(trigger);
            } else {
                log.debug("dropping unknown trigger {} from BuildConfig {}",
                        trigger == null ? null : trigger.getType(),
                        config.getMetadata() == null ? "" : config.getMetadata().getName());
            }
        }
        spec.setTriggers(triggers);
    }

    private static long lastVersion(BuildConfig config) {
        return config.getStatus() == null ? 0 : config.getStatus().getLastVersion();
    }
}
