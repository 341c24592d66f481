package org.huang.origin.api.route;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * 路由对象 routes.route.openshift.io/Route。<br/>
 * spec.host 可以由用户指定，也可以在创建时由分配器生成；status 只由路由器等系统组件写入。
 */
@Group(Route.GROUP)
@Version("v1")
@Plural("routes")
public class Route extends CustomResource<RouteSpec, RouteStatus>
        implements Namespaced {

    public static final String GROUP = "route.openshift.io";

    @Override
    protected RouteSpec initSpec() {
        return new RouteSpec();
    }

    @Override
    protected RouteStatus initStatus() {
        return new RouteStatus();
    }

    @Override
    public String toString() {
        return "Route{" +
                "name=" + getMetadata().getName() +
                ", namespace=" + getMetadata().getNamespace() +
                ", spec=" + spec +
                ", status=" + status +
                '}';
    }
}
