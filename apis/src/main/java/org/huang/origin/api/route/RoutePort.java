package org.huang.origin.api.route;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoutePort {

    /**
     * 目标端口，端口名或端口号
     */
    private String targetPort;
}
