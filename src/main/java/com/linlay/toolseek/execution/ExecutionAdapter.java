package com.linlay.toolseek.execution;

/**
 * 代码执行能力。
 * <p>
 * {@link #execute(String, ExecutionNamespace)} 是硬约束：不得向调用方抛出任何异常。运行时错误以格式化的 traceback
 * 文本返回，空输出返回 {@link #EMPTY_OUTPUT}。同一个 namespace 内前一个代码块定义的变量对后续代码块可见。
 */
public interface ExecutionAdapter {

    String EMPTY_OUTPUT = "(no output)";

    ExecutionNamespace openNamespace();

    String execute(String source, ExecutionNamespace namespace);
}
