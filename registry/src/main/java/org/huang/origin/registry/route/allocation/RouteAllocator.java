package org.huang.origin.registry.route.allocation;

import org.huang.origin.api.route.Route;

/**
 * 为没有指定主机名的路由分配分片并生成主机名。每次调用最多执行一次，不重试。
 */
public interface RouteAllocator {

    RouterShard allocateRouterShard(Route route) throws RouteAllocationException;

    String generateHostname(Route route, RouterShard shard);
}
