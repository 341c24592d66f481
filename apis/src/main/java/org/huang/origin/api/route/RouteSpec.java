package org.huang.origin.api.route;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RouteSpec {

    /**
     * 对外暴露的主机名。为空时可能由分配器生成，一旦持久化就不能再被清空
     */
    private String host;

    private String path;

    private RouteTargetReference to;

    private List<RouteTargetReference> alternateBackends = new ArrayList<>();

    private RoutePort port;

    private TLSConfig tls;

    /**
     * 为 null 等同于 {@link WildcardPolicy#NONE}
     */
    private WildcardPolicy wildcardPolicy;
}
