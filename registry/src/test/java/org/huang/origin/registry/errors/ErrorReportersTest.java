package org.huang.origin.registry.errors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ErrorReportersTest {

    private final ErrorReporter original = ErrorReporters.getDefault();

    @AfterEach
    void restore() {
        ErrorReporters.setDefault(original);
    }

    @Test
    void testDefaultLogs() {
        assertThat(ErrorReporters.getDefault()).isInstanceOf(LoggingErrorReporter.class);
        ErrorReporters.getDefault().handleError(new InternalErrorException("boom", new IllegalStateException("x")));
    }

    @Test
    void testDelegatingReporterFollowsDefault() {
        ErrorReporter delegating = ErrorReporters.delegatingToDefault();
        List<Throwable> seen = new ArrayList<>();
        ErrorReporters.setDefault(seen::add);

        InternalErrorException error = new InternalErrorException("allocation error", new RuntimeException("x"));
        delegating.handleError(error);

        assertThat(seen).containsExactly(error);
        assertThat(error).hasMessage("Internal error occurred: allocation error");
    }
}
