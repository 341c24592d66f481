package org.huang.origin.registry.route.allocation;

import lombok.extern.slf4j.Slf4j;
import org.huang.origin.api.route.Route;

import java.util.Objects;

@Slf4j
public class RouteAllocationController implements RouteAllocator {

    private final RouteAllocationPlugin plugin;

    public RouteAllocationController(RouteAllocationPlugin plugin) {
        this.plugin = Objects.requireNonNull(plugin, "plugin");
    }

    @Override
    public RouterShard allocateRouterShard(Route route) throws RouteAllocationException {
        log.debug("allocating router shard for route {}/{}",
                route.getMetadata().getNamespace(), route.getMetadata().getName());
        RouterShard shard = plugin.allocate(route);
        log.debug("route {} allocated to shard {}", route.getMetadata().getName(), shard.getShardName());
        return shard;
    }

    @Override
    public String generateHostname(Route route, RouterShard shard) {
        return plugin.generateHostname(route, shard);
    }
}
