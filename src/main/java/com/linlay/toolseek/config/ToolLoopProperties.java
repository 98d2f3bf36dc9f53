package com.linlay.toolseek.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "toolseek.tool-loop")
public class ToolLoopProperties {

    private boolean enabled = true;
    private int maxSubRequests = 16;
    private String codeTag = "python";
    private String outputTag = "output";
    private String endOfReasoningMarker = "</think>";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxSubRequests() {
        return maxSubRequests;
    }

    public void setMaxSubRequests(int maxSubRequests) {
        this.maxSubRequests = maxSubRequests;
    }

    public String getCodeTag() {
        return codeTag;
    }

    public void setCodeTag(String codeTag) {
        this.codeTag = codeTag;
    }

    public String getOutputTag() {
        return outputTag;
    }

    public void setOutputTag(String outputTag) {
        this.outputTag = outputTag;
    }

    public String getEndOfReasoningMarker() {
        return endOfReasoningMarker;
    }

    public void setEndOfReasoningMarker(String endOfReasoningMarker) {
        this.endOfReasoningMarker = endOfReasoningMarker;
    }
}
