package com.chatbridge.parser;

import com.chatbridge.model.ToolCall;
import lombok.Value;

import java.util.List;

@Value
public class ParsedDelta {
    static final ParsedDelta EMPTY = new ParsedDelta("", List.of(), false);
    static final ParsedDelta SKIPPED = new ParsedDelta("", List.of(), true);

    String content;
    List<ToolCall> toolCalls;
    boolean skipped;

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
