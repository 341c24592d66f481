package org.huang.origin.api.route;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RouteStatus {

    /**
     * 每个接纳了该路由的路由器写入一条记录
     */
    private List<RouteIngress> ingress = new ArrayList<>();
}
