package com.linlay.toolseek.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.toolseek.execution.ExecutionAdapter;
import com.linlay.toolseek.execution.PythonExecutionAdapter;
import com.linlay.toolseek.service.ToolLoopOrchestrator;
import com.linlay.toolseek.service.ToolLoopPrompts;
import com.linlay.toolseek.stream.sse.ChatChunkEncoder;
import com.linlay.toolseek.stream.sse.SseFlushWriter;
import com.linlay.toolseek.upstream.OpenAiCompatibleUpstreamClient;
import com.linlay.toolseek.upstream.UpstreamClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class RelayConfiguration {

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider upstreamConnectionProvider(UpstreamProperties properties) {
        return ConnectionProvider.builder("toolseek-upstream")
                .maxConnections(Math.max(1, properties.getMaxConnections()))
                .maxIdleTime(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public UpstreamClient upstreamClient(
            UpstreamProperties properties,
            ObjectMapper objectMapper,
            LlmInteractionLogProperties logProperties,
            ConnectionProvider upstreamConnectionProvider
    ) {
        return new OpenAiCompatibleUpstreamClient(properties, objectMapper, logProperties, upstreamConnectionProvider);
    }

    @Bean
    public ExecutionAdapter executionAdapter(PythonExecutionProperties properties, ObjectMapper objectMapper) {
        return new PythonExecutionAdapter(properties, objectMapper);
    }

    @Bean
    public ToolLoopPrompts toolLoopPrompts(ToolLoopProperties properties) {
        return new ToolLoopPrompts(properties.getCodeTag(), properties.getOutputTag(), properties.getEndOfReasoningMarker());
    }

    @Bean
    public ToolLoopOrchestrator toolLoopOrchestrator(
            UpstreamClient upstreamClient,
            ExecutionAdapter executionAdapter,
            ToolLoopPrompts toolLoopPrompts,
            ToolLoopProperties properties
    ) {
        return new ToolLoopOrchestrator(
                upstreamClient,
                executionAdapter,
                toolLoopPrompts,
                properties.getCodeTag(),
                properties.getOutputTag(),
                properties.getEndOfReasoningMarker(),
                properties.getMaxSubRequests()
        );
    }

    @Bean
    public ChatChunkEncoder chatChunkEncoder(ObjectMapper objectMapper) {
        return new ChatChunkEncoder(objectMapper);
    }

    @Bean
    public SseFlushWriter sseFlushWriter() {
        return new SseFlushWriter();
    }
}
