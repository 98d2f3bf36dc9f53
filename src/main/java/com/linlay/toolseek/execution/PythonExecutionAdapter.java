package com.linlay.toolseek.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.toolseek.config.PythonExecutionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 python3 子进程的执行器：每个 namespace 对应一个常驻 worker 进程，代码块通过 stdin/stdout 的 JSON 行协议提交。
 * 先尝试作为表达式求值，失败再按语句执行；stdout/stderr 与 traceback 一并捕获。
 */
public class PythonExecutionAdapter implements ExecutionAdapter {

    private static final Logger log = LoggerFactory.getLogger(PythonExecutionAdapter.class);
    static final String WORKER_SCRIPT = "python/toolseek_worker.py";

    private final PythonExecutionProperties properties;
    private final ObjectMapper objectMapper;
    private volatile String workerScript;

    public PythonExecutionAdapter(PythonExecutionProperties properties, ObjectMapper objectMapper) {
        this.properties = Objects.requireNonNull(properties, "properties cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    @Override
    public ExecutionNamespace openNamespace() {
        return new PythonNamespace(properties, this::workerScript);
    }

    @Override
    public String execute(String source, ExecutionNamespace namespace) {
        if (!(namespace instanceof PythonNamespace pythonNamespace)) {
            return "Execution failed: unsupported namespace " + (namespace == null ? "null" : namespace.getClass().getSimpleName());
        }
        String code = source == null ? "" : source;
        long startNanos = System.nanoTime();
        try {
            String request = objectMapper.writeValueAsString(Map.of("code", code));
            PythonNamespace.Reply reply = pythonNamespace.submit(request);
            String output = switch (reply.status()) {
                case OK -> readOutput(reply.line());
                case TIMEOUT -> "Execution timed out after " + properties.getTimeoutSeconds()
                        + " s; the Python namespace was reset.";
                case EXITED -> "Python worker exited unexpectedly; the Python namespace was reset.";
            };
            log.debug("[{}] executed python block chars={}, status={}, elapsedMs={}",
                    namespace.id(), code.length(), reply.status(), (System.nanoTime() - startNanos) / 1_000_000);
            return normalize(output);
        } catch (Exception ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("[{}] python execution failed", namespace.id(), ex);
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return "Execution failed: " + message;
        }
    }

    private String readOutput(String line) throws IOException {
        JsonNode root = objectMapper.readTree(line);
        return root.path("output").asText("");
    }

    private String normalize(String output) {
        if (output == null || output.isBlank()) {
            return EMPTY_OUTPUT;
        }
        String trimmed = stripTrailingNewlines(output);
        int limit = properties.getMaxOutputChars();
        if (limit > 0 && trimmed.length() > limit) {
            return trimmed.substring(0, limit) + "\n... (truncated " + (trimmed.length() - limit) + " chars)";
        }
        return trimmed;
    }

    private String stripTrailingNewlines(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }

    private String workerScript() throws IOException {
        String script = workerScript;
        if (script == null) {
            try (InputStream input = new ClassPathResource(WORKER_SCRIPT).getInputStream()) {
                script = new String(input.readAllBytes(), StandardCharsets.UTF_8);
            }
            workerScript = script;
        }
        return script;
    }
}
