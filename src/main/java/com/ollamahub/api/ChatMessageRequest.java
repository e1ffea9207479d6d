package com.ollamahub.api;

import com.ollamahub.orchestration.model.ConversationMessage;
import com.ollamahub.orchestration.model.MessageRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ChatMessageRequest(
        @NotNull @Pattern(regexp = "user|assistant|system", message = "must be one of user, assistant, system") String role,
        @NotBlank @Size(max = 20000) String content
) {

    public ConversationMessage toConversationMessage() {
        return new ConversationMessage(MessageRole.fromValue(role), content.strip());
    }
}
