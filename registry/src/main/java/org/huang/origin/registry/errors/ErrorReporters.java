package org.huang.origin.registry.errors;

import java.util.Objects;

/**
 * 进程级的错误接收端，默认写日志。测试或嵌入方可以替换。
 */
public final class ErrorReporters {

    private static volatile ErrorReporter defaultReporter = new LoggingErrorReporter();

    private ErrorReporters() {
    }

    public static ErrorReporter getDefault() {
        return defaultReporter;
    }

    public static void setDefault(ErrorReporter reporter) {
        defaultReporter = Objects.requireNonNull(reporter, "reporter");
    }

    /**
     * 转发到当前默认接收端，而不是在构造时固定下来
     */
    public static ErrorReporter delegatingToDefault() {
        return error -> defaultReporter.handleError(error);
    }
}
