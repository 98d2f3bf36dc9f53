package com.linlay.toolseek.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.toolseek.config.PythonExecutionProperties;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonExecutionAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeAll
    static void requirePython() {
        assumeTrue(pythonAvailable(), "python3 is not available on this machine");
    }

    @Test
    void shouldCapturePrintedOutput() {
        PythonExecutionAdapter adapter = newAdapter(10, 8000);
        try (ExecutionNamespace namespace = adapter.openNamespace()) {
            assertThat(adapter.execute("print(2 + 2)", namespace)).isEqualTo("4");
        }
    }

    @Test
    void shouldReturnTracebackInsteadOfThrowing() {
        PythonExecutionAdapter adapter = newAdapter(10, 8000);
        try (ExecutionNamespace namespace = adapter.openNamespace()) {
            String output = adapter.execute("x = 1\n1 / 0", namespace);

            assertThat(output).startsWith("Traceback");
            assertThat(output).contains("ZeroDivisionError");
        }
    }

    @Test
    void shouldKeepVariablesAcrossBlocksOfOneNamespace() {
        PythonExecutionAdapter adapter = newAdapter(10, 8000);
        try (ExecutionNamespace first = adapter.openNamespace();
             ExecutionNamespace second = adapter.openNamespace()) {
            assertThat(adapter.execute("answer = 21", first)).isEqualTo(ExecutionAdapter.EMPTY_OUTPUT);
            assertThat(adapter.execute("print(answer * 2)", first)).isEqualTo("42");
            assertThat(adapter.execute("print(answer)", second)).contains("NameError");
        }
    }

    @Test
    void shouldShowValueOfBareExpression() {
        PythonExecutionAdapter adapter = newAdapter(10, 8000);
        try (ExecutionNamespace namespace = adapter.openNamespace()) {
            assertThat(adapter.execute("6 * 7", namespace)).isEqualTo("42");
            assertThat(adapter.execute("'a' + 'b'", namespace)).isEqualTo("'ab'");
            assertThat(adapter.execute("None", namespace)).isEqualTo(ExecutionAdapter.EMPTY_OUTPUT);
        }
    }

    @Test
    void shouldDedentIndentedBlocksAndCaptureStderr() {
        PythonExecutionAdapter adapter = newAdapter(10, 8000);
        try (ExecutionNamespace namespace = adapter.openNamespace()) {
            String output = adapter.execute("\n    import sys\n    print('out')\n    print('err', file=sys.stderr)\n", namespace);

            assertThat(output).isEqualTo("out\nerr");
        }
    }

    @Test
    void shouldTruncateLongOutput() {
        PythonExecutionAdapter adapter = newAdapter(10, 10);
        try (ExecutionNamespace namespace = adapter.openNamespace()) {
            String output = adapter.execute("print('x' * 25)", namespace);

            assertThat(output).startsWith("xxxxxxxxxx\n");
            assertThat(output).contains("truncated 15 chars");
        }
    }

    @Test
    void shouldResetNamespaceAfterTimeout() {
        PythonExecutionAdapter adapter = newAdapter(1, 8000);
        try (ExecutionNamespace namespace = adapter.openNamespace()) {
            adapter.execute("kept = 1", namespace);

            assertThat(adapter.execute("import time\ntime.sleep(10)", namespace)).contains("timed out");
            assertThat(adapter.execute("print('alive')", namespace)).isEqualTo("alive");
            assertThat(adapter.execute("print(kept)", namespace)).contains("NameError");
        }
    }

    @Test
    void shouldReportFailureAfterNamespaceClosed() {
        PythonExecutionAdapter adapter = newAdapter(10, 8000);
        ExecutionNamespace namespace = adapter.openNamespace();
        namespace.close();

        assertThat(adapter.execute("print(1)", namespace)).startsWith("Execution failed");
    }

    private PythonExecutionAdapter newAdapter(long timeoutSeconds, int maxOutputChars) {
        PythonExecutionProperties properties = new PythonExecutionProperties();
        properties.setTimeoutSeconds(timeoutSeconds);
        properties.setMaxOutputChars(maxOutputChars);
        return new PythonExecutionAdapter(properties, objectMapper);
    }

    private static boolean pythonAvailable() {
        try {
            Process process = new ProcessBuilder("python3", "--version")
                    .redirectErrorStream(true)
                    .start();
            return process.waitFor(5, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (Exception ex) {
            return false;
        }
    }
}
