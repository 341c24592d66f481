package org.huang.origin.api.validation;

import java.util.regex.Pattern;

public final class NameValidation {

    public static final int DNS1123_LABEL_MAX_LENGTH = 63;
    public static final int DNS1123_SUBDOMAIN_MAX_LENGTH = 253;

    private static final String DNS1123_LABEL_FMT = "[a-z0-9]([-a-z0-9]*[a-z0-9])?";

    private static final Pattern DNS1123_LABEL = Pattern.compile(DNS1123_LABEL_FMT);
    private static final Pattern DNS1123_SUBDOMAIN =
            Pattern.compile(DNS1123_LABEL_FMT + "(\\." + DNS1123_LABEL_FMT + ")*");

    public static final String DNS1123_LABEL_MESSAGE =
            "a DNS-1123 label must consist of lower case alphanumeric characters or '-', "
                    + "and must start and end with an alphanumeric character";
    public static final String DNS1123_SUBDOMAIN_MESSAGE =
            "a DNS-1123 subdomain must consist of lower case alphanumeric characters, '-' or '.', "
                    + "and must start and end with an alphanumeric character";

    private NameValidation() {
    }

    public static boolean isDns1123Label(String value) {
        return value != null
                && value.length() <= DNS1123_LABEL_MAX_LENGTH
                && DNS1123_LABEL.matcher(value).matches();
    }

    public static boolean isDns1123Subdomain(String value) {
        return value != null
                && value.length() <= DNS1123_SUBDOMAIN_MAX_LENGTH
                && DNS1123_SUBDOMAIN.matcher(value).matches();
    }
}
