package org.huang.origin.registry.errors;

/**
 * 非致命内部错误的接收端。调用方不等待结果，也不关心处理方式。
 */
@FunctionalInterface
public interface ErrorReporter {

    void handleError(Throwable error);
}
