package com.chatbridge.tools;

import lombok.Value;

@Value
public class ToolChoice {

    public static final ToolChoice AUTO = new ToolChoice(Mode.AUTO, null);
    public static final ToolChoice NONE = new ToolChoice(Mode.NONE, null);

    Mode mode;
    String functionName;

    public enum Mode {
        AUTO, NONE, FORCED
    }

    public static ToolChoice forced(String functionName) {
        return new ToolChoice(Mode.FORCED, functionName);
    }

    public boolean disablesTools() {
        return mode == Mode.NONE;
    }
}
