package org.huang.origin.api.build.validation;

import org.huang.origin.api.build.BuildConfig;
import org.huang.origin.api.build.BuildConfigSpec;
import org.huang.origin.api.build.BuildConfigStatus;
import org.huang.origin.api.build.BuildTriggerPolicy;
import org.huang.origin.api.build.BuildTriggerTypes;
import org.huang.origin.api.build.WebHookTrigger;
import org.huang.origin.api.validation.FieldError;
import org.huang.origin.api.validation.FieldPath;
import org.huang.origin.api.validation.ObjectMetaValidation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

public class DefaultBuildConfigValidator implements BuildConfigValidator {

    public static final DefaultBuildConfigValidator INSTANCE = new DefaultBuildConfigValidator();

    static final Set<String> RUN_POLICIES = Set.of(
            BuildConfigSpec.RUN_POLICY_SERIAL,
            BuildConfigSpec.RUN_POLICY_PARALLEL,
            BuildConfigSpec.RUN_POLICY_SERIAL_LATEST_ONLY);

    @Override
    public List<FieldError> validateBuildConfig(BuildConfig config) {
        List<FieldError> errors = new ArrayList<>(
                ObjectMetaValidation.validateObjectMeta(config.getMetadata(), true, FieldPath.root("metadata")));

        FieldPath specPath = FieldPath.root("spec");
        BuildConfigSpec spec = config.getSpec();
        if (spec == null) {
            errors.add(FieldError.required(specPath, ""));
            return errors;
        }

        String runPolicy = spec.getRunPolicy();
        if (runPolicy != null && !runPolicy.isEmpty() && !RUN_POLICIES.contains(runPolicy)) {
            errors.add(FieldError.notSupported(specPath.child("runPolicy"), runPolicy, RUN_POLICIES));
        }

        if (spec.getTriggers() != null) {
            int configChangeCount = 0;
            for (int i = 0; i < spec.getTriggers().size(); i++) {
                BuildTriggerPolicy trigger = spec.getTriggers().get(i);
                FieldPath triggerPath = specPath.child("triggers").index(i);
                if (trigger != null && BuildTriggerTypes.CONFIG_CHANGE.equals(trigger.getType())) {
                    configChangeCount++;
                    if (configChangeCount > 1) {
                        errors.add(FieldError.invalid(triggerPath, trigger.getType(),
                                "only one ConfigChange trigger is allowed"));
                    }
                }
                errors.addAll(validateTrigger(trigger, triggerPath));
            }
        }

        errors.addAll(validateHistoryLimit(spec.getSuccessfulBuildsHistoryLimit(),
                specPath.child("successfulBuildsHistoryLimit")));
        errors.addAll(validateHistoryLimit(spec.getFailedBuildsHistoryLimit(),
                specPath.child("failedBuildsHistoryLimit")));

        BuildConfigStatus status = config.getStatus();
        if (status != null && status.getLastVersion() < 0) {
            errors.add(FieldError.invalid(FieldPath.root("status", "lastVersion"), status.getLastVersion(),
                    "must be greater than or equal to 0"));
        }
        return errors;
    }

    @Override
    public List<FieldError> validateBuildConfigUpdate(BuildConfig config, BuildConfig old) {
        List<FieldError> errors = new ArrayList<>(ObjectMetaValidation.validateObjectMetaUpdate(
                config.getMetadata(), old.getMetadata(), FieldPath.root("metadata")));
        errors.addAll(validateBuildConfig(config));
        return errors;
    }

    List<FieldError> validateTrigger(BuildTriggerPolicy trigger, FieldPath path) {
        List<FieldError> errors = new ArrayList<>();
        if (trigger == null || trigger.getType() == null || trigger.getType().isEmpty()) {
            errors.add(FieldError.required(path.child("type"), "must provide a build trigger type"));
            return errors;
        }

        long payloads = Stream.of(trigger.getGithub(), trigger.getGeneric(), trigger.getGitlab(),
                trigger.getBitbucket(), trigger.getImageChange()).filter(p -> p != null).count();
        if (payloads > 1) {
            errors.add(FieldError.invalid(path, trigger.getType(),
                    "a trigger may carry only the settings of its own type"));
        }

        switch (trigger.getType()) {
            case BuildTriggerTypes.GITHUB:
                errors.addAll(validateWebHook(trigger.getGithub(), path.child("github")));
                break;
            case BuildTriggerTypes.GENERIC:
                errors.addAll(validateWebHook(trigger.getGeneric(), path.child("generic")));
                break;
            case BuildTriggerTypes.GITLAB:
                errors.addAll(validateWebHook(trigger.getGitlab(), path.child("gitlab")));
                break;
            case BuildTriggerTypes.BITBUCKET:
                errors.addAll(validateWebHook(trigger.getBitbucket(), path.child("bitbucket")));
                break;
            case BuildTriggerTypes.IMAGE_CHANGE:
                if (trigger.getImageChange() == null) {
                    errors.add(FieldError.required(path.child("imageChange"), ""));
                }
                break;
            case BuildTriggerTypes.CONFIG_CHANGE:
                break;
            default:
                errors.add(FieldError.notSupported(path.child("type"), trigger.getType(), BuildTriggerTypes.KNOWN));
        }
        return errors;
    }

    private List<FieldError> validateWebHook(WebHookTrigger webHook, FieldPath path) {
        if (webHook == null) {
            return List.of(FieldError.required(path, ""));
        }
        if (webHook.getSecret() == null || webHook.getSecret().isEmpty()) {
            return List.of(FieldError.required(path.child("secret"), "webhook secret must not be empty"));
        }
        return List.of();
    }

    private List<FieldError> validateHistoryLimit(Integer limit, FieldPath path) {
        if (limit != null && limit < 0) {
            return List.of(FieldError.invalid(path, limit, "must be greater than or equal to 0"));
        }
        return List.of();
    }
}
