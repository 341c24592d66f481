package org.huang.origin.api.build;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BuildConfigSpec {

    public static final String RUN_POLICY_SERIAL = "Serial";
    public static final String RUN_POLICY_PARALLEL = "Parallel";
    public static final String RUN_POLICY_SERIAL_LATEST_ONLY = "SerialLatestOnly";

    /**
     * 触发构建的规则，按声明顺序保存
     */
    private List<BuildTriggerPolicy> triggers = new ArrayList<>();

    private String runPolicy;

    private String serviceAccount;

    private Integer successfulBuildsHistoryLimit;

    private Integer failedBuildsHistoryLimit;
}
