package org.huang.origin.registry.config;

import lombok.Builder;
import lombok.Value;
import org.huang.origin.registry.route.allocation.SimpleAllocationPlugin;

import java.util.Map;

/**
 * 进程级配置，从环境变量读取：
 * <ul>
 *     <li>ROUTE_HOST_ALLOCATION：是否为路由生成主机名，默认 true</li>
 *     <li>ROUTER_SUBDOMAIN：生成主机名使用的 DNS 后缀，默认 router.default.svc.cluster.local</li>
 * </ul>
 */
@Value
@Builder
public class RegistryConfig {

    public static final String ENV_ROUTE_HOST_ALLOCATION = "ROUTE_HOST_ALLOCATION";
    public static final String ENV_ROUTER_SUBDOMAIN = "ROUTER_SUBDOMAIN";

    @Builder.Default
    boolean routeHostAllocation = true;

    @Builder.Default
    String routerSubdomain = SimpleAllocationPlugin.DEFAULT_DNS_SUFFIX;

    public static RegistryConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static RegistryConfig fromEnvironment(Map<String, String> env) {
        String allocation = env.getOrDefault(ENV_ROUTE_HOST_ALLOCATION, "true").trim();
        String subdomain = env.getOrDefault(ENV_ROUTER_SUBDOMAIN, SimpleAllocationPlugin.DEFAULT_DNS_SUFFIX).trim();
        if (subdomain.isEmpty()) {
            subdomain = SimpleAllocationPlugin.DEFAULT_DNS_SUFFIX;
        }
        return RegistryConfig.builder()
                .routeHostAllocation(Boolean.parseBoolean(allocation))
                .routerSubdomain(subdomain)
                .build();
    }
}
