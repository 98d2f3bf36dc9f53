package com.linlay.toolseek.service;

import com.linlay.toolseek.execution.ExecutionAdapter;
import com.linlay.toolseek.execution.ExecutionNamespace;
import com.linlay.toolseek.upstream.UpstreamClient;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 回合级上下文：持有上游客户端句柄与本回合独占的执行 namespace，回合结束或客户端断开时释放。
 */
final class TurnContext implements AutoCloseable {

    private final String turnId;
    private final String model;
    private final Map<String, Object> parameters;
    private final UpstreamClient upstreamClient;
    private final ExecutionAdapter executionAdapter;
    private final ExecutionNamespace namespace;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    TurnContext(
            String turnId,
            String model,
            Map<String, Object> parameters,
            UpstreamClient upstreamClient,
            ExecutionAdapter executionAdapter
    ) {
        this.turnId = turnId;
        this.model = model;
        this.parameters = parameters == null ? Map.of() : parameters;
        this.upstreamClient = upstreamClient;
        this.executionAdapter = executionAdapter;
        this.namespace = executionAdapter.openNamespace();
    }

    String turnId() {
        return turnId;
    }

    String model() {
        return model;
    }

    Map<String, Object> parameters() {
        return parameters;
    }

    UpstreamClient upstream() {
        return upstreamClient;
    }

    String execute(String source) {
        return executionAdapter.execute(source, namespace);
    }

    boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            namespace.close();
        }
    }
}
