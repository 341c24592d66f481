package org.huang.origin.registry.route.allocation;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import lombok.extern.slf4j.Slf4j;
import org.huang.origin.api.route.Route;

/**
 * 只有一个默认分片的分配算法，主机名形如 {@code <name>-<namespace>.<subdomain>}
 */
@Slf4j
public class SimpleAllocationPlugin implements RouteAllocationPlugin {

    public static final String DEFAULT_SHARD_NAME = "default";
    public static final String DEFAULT_DNS_SUFFIX = "router.default.svc.cluster.local";

    private final RouterShard defaultShard;

    public SimpleAllocationPlugin(String subdomain) {
        if (subdomain == null || subdomain.isEmpty()) {
            throw new IllegalArgumentException("router subdomain must not be empty");
        }
        this.defaultShard = new RouterShard(DEFAULT_SHARD_NAME, subdomain);
        log.info("Route plugin initialized with suffix={}", subdomain);
    }

    @Override
    public RouterShard allocate(Route route) throws RouteAllocationException {
        ObjectMeta meta = route.getMetadata();
        if (meta == null || isEmpty(meta.getName()) || isEmpty(meta.getNamespace())) {
            throw new RouteAllocationException("route name and namespace are required to allocate a host");
        }
        return defaultShard;
    }

    @Override
    public String generateHostname(Route route, RouterShard shard) {
        ObjectMeta meta = route.getMetadata();
        return meta.getName() + "-" + meta.getNamespace() + "." + shard.getDnsSuffix();
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
