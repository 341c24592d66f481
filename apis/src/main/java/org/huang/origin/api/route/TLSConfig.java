package org.huang.origin.api.route;

import lombok.Data;

import java.util.Set;

@Data
public class TLSConfig {

    public static final String TERMINATION_EDGE = "edge";
    public static final String TERMINATION_PASSTHROUGH = "passthrough";
    public static final String TERMINATION_REENCRYPT = "reencrypt";

    public static final Set<String> TERMINATION_TYPES =
            Set.of(TERMINATION_EDGE, TERMINATION_PASSTHROUGH, TERMINATION_REENCRYPT);

    public static final String INSECURE_POLICY_NONE = "None";
    public static final String INSECURE_POLICY_ALLOW = "Allow";
    public static final String INSECURE_POLICY_REDIRECT = "Redirect";

    public static final Set<String> INSECURE_POLICIES =
            Set.of(INSECURE_POLICY_NONE, INSECURE_POLICY_ALLOW, INSECURE_POLICY_REDIRECT);

    private String termination;

    private String certificate;

    private String key;

    private String caCertificate;

    private String destinationCACertificate;

    private String insecureEdgeTerminationPolicy;
}
