package org.huang.origin.api.build;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条构建触发规则。type 保持字符串形式，客户端提交的未知类型需要能被反序列化，
 * 然后在 PrepareForCreate / PrepareForUpdate 阶段被丢弃。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BuildTriggerPolicy {

    private String type;

    private WebHookTrigger github;

    private WebHookTrigger generic;

    private WebHookTrigger gitlab;

    private WebHookTrigger bitbucket;

    private ImageChangeTrigger imageChange;

    public static BuildTriggerPolicy ofType(String type) {
        return BuildTriggerPolicy.builder().type(type).build();
    }
}
