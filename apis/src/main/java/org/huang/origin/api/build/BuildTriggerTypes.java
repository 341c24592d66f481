package org.huang.origin.api.build;

import java.util.Set;

/**
 * 构建触发类型。集合 {@link #KNOWN} 之外的类型不会被持久化。
 */
public final class BuildTriggerTypes {

    public static final String GITHUB = "GitHub";
    public static final String GENERIC = "Generic";
    public static final String GITLAB = "GitLab";
    public static final String BITBUCKET = "Bitbucket";
    public static final String IMAGE_CHANGE = "ImageChange";
    public static final String CONFIG_CHANGE = "ConfigChange";

    public static final Set<String> KNOWN =
            Set.of(GITHUB, GENERIC, GITLAB, BITBUCKET, IMAGE_CHANGE, CONFIG_CHANGE);

    private BuildTriggerTypes() {
    }

    public static boolean isKnown(String type) {
        return type != null && KNOWN.contains(type);
    }
}
