package com.linlay.toolseek.execution;

import com.linlay.toolseek.config.PythonExecutionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 一个回合的 Python 全局变量空间，由常驻 worker 进程持有。worker 懒启动，超时或异常退出后销毁，下次提交时重建。
 */
class PythonNamespace implements ExecutionNamespace {

    private static final Logger log = LoggerFactory.getLogger(PythonNamespace.class);

    enum Status {
        OK,
        TIMEOUT,
        EXITED
    }

    record Reply(Status status, String line) {
    }

    @FunctionalInterface
    interface ScriptSource {
        String load() throws IOException;
    }

    private final String id = "py-" + UUID.randomUUID().toString().substring(0, 8);
    private final PythonExecutionProperties properties;
    private final ScriptSource scriptSource;
    private final ExecutorService reader;
    private volatile Process process;
    private volatile boolean closed;
    private BufferedWriter stdin;
    private BufferedReader stdout;

    PythonNamespace(PythonExecutionProperties properties, ScriptSource scriptSource) {
        this.properties = properties;
        this.scriptSource = scriptSource;
        this.reader = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "python-exec-" + id);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String id() {
        return id;
    }

    synchronized Reply submit(String requestLine) throws IOException, InterruptedException {
        if (closed) {
            throw new IllegalStateException("Namespace " + id + " is closed");
        }
        ensureStarted();
        stdin.write(requestLine);
        stdin.write('\n');
        stdin.flush();

        Future<String> pendingReply = reader.submit(stdout::readLine);
        try {
            String line = pendingReply.get(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
            if (line == null) {
                log.warn("[{}] python worker exited with code {}", id, exitCodeOrUnknown());
                destroyWorker();
                return new Reply(Status.EXITED, null);
            }
            return new Reply(Status.OK, line);
        } catch (TimeoutException ex) {
            pendingReply.cancel(true);
            log.warn("[{}] python block timed out after {} s", id, properties.getTimeoutSeconds());
            destroyWorker();
            return new Reply(Status.TIMEOUT, null);
        } catch (ExecutionException ex) {
            destroyWorker();
            Throwable cause = ex.getCause();
            throw cause instanceof IOException io ? io : new IOException(cause);
        }
    }

    /**
     * 可能在客户端断开的线程上调用，不获取提交锁；正在等待结果的 submit 会读到 EOF 并返回 EXITED。
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Process worker = process;
        if (worker != null) {
            worker.destroyForcibly();
        }
        reader.shutdownNow();
    }

    private void ensureStarted() throws IOException {
        if (process != null && process.isAlive()) {
            return;
        }
        destroyWorker();
        process = new ProcessBuilder(properties.getCommand(), "-u", "-c", scriptSource.load())
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        log.debug("[{}] started python worker pid={}", id, process.pid());
    }

    private void destroyWorker() {
        Process worker = process;
        if (worker == null) {
            return;
        }
        try {
            stdin.close();
        } catch (IOException ex) {
            log.debug("[{}] failed to close python worker stdin: {}", id, ex.getMessage());
        }
        worker.destroyForcibly();
        process = null;
        stdin = null;
        stdout = null;
    }

    private String exitCodeOrUnknown() {
        Process worker = process;
        if (worker == null) {
            return "unknown";
        }
        try {
            return worker.waitFor(1, TimeUnit.SECONDS) ? String.valueOf(worker.exitValue()) : "unknown";
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return "unknown";
        }
    }
}
