package org.huang.origin.registry.route.allocation;

import org.huang.origin.api.route.Route;

/**
 * 具体的分配算法，由 {@link RouteAllocationController} 调用
 */
public interface RouteAllocationPlugin {

    RouterShard allocate(Route route) throws RouteAllocationException;

    String generateHostname(Route route, RouterShard shard);
}
