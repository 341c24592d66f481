package org.huang.origin.api.build;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * 构建配置对象 buildconfigs.build.openshift.io/BuildConfig。<br/>
 * spec.triggers 描述哪些事件会触发一次构建，status.lastVersion 是系统维护的构建序号，只增不减。
 */
@Group(BuildConfig.GROUP)
@Version("v1")
@ShortNames("bc")
@Plural("buildconfigs")
public class BuildConfig extends CustomResource<BuildConfigSpec, BuildConfigStatus>
        implements Namespaced {

    public static final String GROUP = "build.openshift.io";

    @Override
    protected BuildConfigSpec initSpec() {
        return new BuildConfigSpec();
    }

    @Override
    protected BuildConfigStatus initStatus() {
        return new BuildConfigStatus();
    }

    @Override
    public String toString() {
        return "BuildConfig{" +
                "name=" + getMetadata().getName() +
                ", spec=" + spec +
                ", status=" + status +
                '}';
    }
}
