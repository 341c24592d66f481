package org.huang.origin.api.route;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteIngressCondition {

    public static final String TYPE_ADMITTED = "Admitted";

    private String type;

    private String status;

    private String reason;

    private String message;

    private String lastTransitionTime;
}
