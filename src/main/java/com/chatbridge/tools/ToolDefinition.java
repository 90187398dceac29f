package com.chatbridge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class ToolDefinition implements WireTool {
    String name;
    String description;
    JsonNode parameters;
}
