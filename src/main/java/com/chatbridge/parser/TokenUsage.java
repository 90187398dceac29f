package com.chatbridge.parser;

import com.chatbridge.model.Usage;
import lombok.Value;

@Value
public class TokenUsage {
    int promptTokens;
    int completionTokens;
    boolean exact;

    public static TokenUsage exact(int promptTokens, int completionTokens) {
        return new TokenUsage(promptTokens, completionTokens, true);
    }

    public static TokenUsage estimated(int promptTokens, String completionText) {
        return new TokenUsage(promptTokens, TokenEstimator.estimate(completionText), false);
    }

    public int getTotalTokens() {
        return promptTokens + completionTokens;
    }

    public Usage toWire() {
        return new Usage(promptTokens, completionTokens, getTotalTokens());
    }
}
