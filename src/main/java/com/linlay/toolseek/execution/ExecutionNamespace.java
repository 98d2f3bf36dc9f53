package com.linlay.toolseek.execution;

/**
 * 单个回合内持久的执行环境句柄，回合结束时关闭。
 */
public interface ExecutionNamespace extends AutoCloseable {

    String id();

    @Override
    void close();
}
