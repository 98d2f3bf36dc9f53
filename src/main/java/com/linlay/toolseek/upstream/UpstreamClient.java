package com.linlay.toolseek.upstream;

import com.linlay.toolseek.model.ChatDelta;
import reactor.core.publisher.Flux;

/**
 * 上游模型接口：一次调用对应一次流式 chat completion。
 * 返回的 Flux 是冷的，取消订阅即放弃该次 HTTP 请求；传输失败以 error 信号结束。
 */
public interface UpstreamClient {

    Flux<ChatDelta> stream(UpstreamRequest request);
}
