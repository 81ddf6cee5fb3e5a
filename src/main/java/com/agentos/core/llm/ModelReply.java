package com.agentos.core.llm;

/**
 * Raw reply from one provider call.
 */
public record ModelReply(String text, TokenUsage usage) {}
