package com.linlay.toolseek.service;

/**
 * 回合状态机。DONE / FAILED / CANCELLED 为终态，RESTARTING 表示以更长的 prefix 发起下一次子请求。
 */
public enum TurnPhase {
    REQUESTING,
    STREAMING,
    EXECUTING,
    RESTARTING,
    FORWARDING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
