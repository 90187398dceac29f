package com.chatbridge.parser;

import com.chatbridge.model.FinishReason;
import com.chatbridge.model.ToolCall;
import com.chatbridge.tools.BackendToolConfig;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated parse state for one backend response. Confined to a single subscriber.
 */
@Getter
public class ParserState {

    private final BackendToolConfig toolConfig;
    private final int promptTokens;
    private final MarkupFilter markupFilter = new MarkupFilter();
    private final StringBuilder content = new StringBuilder();
    private final List<ToolCall> toolCalls = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private boolean partialMessageSeen;
    private boolean textSeen;
    private boolean resultSeen;
    private TokenUsage reportedUsage;
    private FinishReason finishHint;
    private String resultText;
    private int skippedChunks;
    private boolean finished;

    ParserState(BackendToolConfig toolConfig, int promptTokens) {
        this.toolConfig = toolConfig;
        this.promptTokens = promptTokens;
    }

    void markPartialMessageSeen(boolean seen) {
        this.partialMessageSeen = seen;
    }

    void markTextSeen() {
        this.textSeen = true;
    }

    void recordResult(String text, TokenUsage usage, FinishReason hint) {
        this.resultSeen = true;
        this.resultText = text;
        if (usage != null) {
            this.reportedUsage = usage;
        }
        if (hint != null) {
            this.finishHint = hint;
        }
    }

    public void markLength() {
        this.finishHint = FinishReason.LENGTH;
    }

    void recordSkipped() {
        skippedChunks++;
    }

    void markFinished() {
        this.finished = true;
    }

    public String contentSoFar() {
        return content.toString();
    }
}
