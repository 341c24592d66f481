package org.huang.origin.api.route;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteTargetReference {

    public static final String KIND_SERVICE = "Service";

    private String kind;

    private String name;

    private Integer weight;

    public static RouteTargetReference service(String name) {
        return new RouteTargetReference(KIND_SERVICE, name, null);
    }
}
