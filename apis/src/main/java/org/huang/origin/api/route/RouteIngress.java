package org.huang.origin.api.route;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RouteIngress {

    private String host;

    private String routerName;

    private WildcardPolicy wildcardPolicy;

    private String routerCanonicalHostname;

    private List<RouteIngressCondition> conditions = new ArrayList<>();
}
