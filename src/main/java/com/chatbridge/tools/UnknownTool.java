package com.chatbridge.tools;

import lombok.Value;

@Value
public class UnknownTool implements WireTool {
    int position;
    String type;
}
