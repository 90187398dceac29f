package com.chatbridge.tools;

public interface WireTool {
}
