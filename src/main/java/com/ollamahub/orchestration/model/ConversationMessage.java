package com.ollamahub.orchestration.model;

import org.springframework.util.Assert;

public record ConversationMessage(MessageRole role, String content) {

    public ConversationMessage {
        Assert.notNull(role, "Message role must not be null");
        Assert.notNull(content, "Message content must not be null");
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(MessageRole.USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(MessageRole.ASSISTANT, content);
    }
}
