package org.huang.origin.api.build;

import io.fabric8.kubernetes.api.model.ObjectReference;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageChangeTrigger {

    private String lastTriggeredImageID;

    /**
     * 为空时使用构建策略中声明的镜像
     */
    private ObjectReference from;
}
