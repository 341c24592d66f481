package org.huang.origin.registry.errors;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingErrorReporter implements ErrorReporter {

    @Override
    public void handleError(Throwable error) {
        log.error("Observed a non-fatal internal error: {}", error.getMessage(), error);
    }
}
