package org.huang.origin.api.build;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WebHookTrigger {

    private String secret;

    /**
     * 仅对 Generic 类型有意义：是否允许 webhook 请求体携带环境变量
     */
    private boolean allowEnv;
}
