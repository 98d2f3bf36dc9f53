package com.linlay.toolseek.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/* 执行器默认使用宿主机 python3，没有任何隔离；生产部署应替换为隔离的 ExecutionAdapter 实现。
```yaml
toolseek:
  execution:
    python:
      command: /usr/bin/python3
      timeout-seconds: 30
```
*/
@ConfigurationProperties(prefix = "toolseek.execution.python")
public class PythonExecutionProperties {

    private String command = "python3";
    private long timeoutSeconds = 30;
    private int maxOutputChars = 8000;

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxOutputChars() {
        return maxOutputChars;
    }

    public void setMaxOutputChars(int maxOutputChars) {
        this.maxOutputChars = maxOutputChars;
    }
}
