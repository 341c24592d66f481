package org.huang.origin.api.build;

import lombok.Data;

@Data
public class BuildConfigStatus {

    /**
     * 最近一次构建的序号，由系统写入
     */
    private long lastVersion;
}
