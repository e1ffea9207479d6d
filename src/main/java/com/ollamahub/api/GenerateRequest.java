package com.ollamahub.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ollamahub.orchestration.model.ConversationMessage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Either a single {@code prompt} or a {@code messages} history. When both are sent the history
 * wins.
 */
public record GenerateRequest(
        @Size(max = 10000) String prompt,
        List<@NotNull @Valid ChatMessageRequest> messages
) {

    @JsonIgnore
    @AssertTrue(message = "either prompt or messages must be provided")
    public boolean isPayloadPresent() {
        return hasMessages() || StringUtils.hasText(prompt);
    }

    @JsonIgnore
    @AssertTrue(message = "the last message must have role user")
    public boolean isLastMessageFromUser() {
        if (!hasMessages()) {
            return true;
        }
        ChatMessageRequest last = messages.get(messages.size() - 1);
        return last != null && "user".equals(last.role());
    }

    public List<ConversationMessage> toConversation() {
        if (hasMessages()) {
            return messages.stream().map(ChatMessageRequest::toConversationMessage).toList();
        }
        return List.of(ConversationMessage.user(prompt.strip()));
    }

    private boolean hasMessages() {
        return messages != null && !messages.isEmpty();
    }
}
