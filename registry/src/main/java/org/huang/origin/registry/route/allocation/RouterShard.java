package org.huang.origin.registry.route.allocation;

import lombok.Value;

/**
 * 路由器分片。生成的主机名落在分片的 DNS 后缀下面
 */
@Value
public class RouterShard {

    String shardName;

    String dnsSuffix;
}
