package com.ollamahub.client;

import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.ConversationMessage;

import java.util.List;

/**
 * Blocking, single-attempt chat call against one configured endpoint.
 */
public interface ChatEndpointClient {

    /**
     * Sends the conversation to the agent's endpoint and returns the generated text.
     *
     * @param agent the endpoint, model and timeout to use.
     * @param messages the conversation to send, oldest first.
     * @return the text of the assistant reply, never {@code null}.
     * @throws org.springframework.web.client.ResourceAccessException on I/O failure or socket timeout.
     * @throws org.springframework.web.client.RestClientResponseException on a non-2xx status.
     * @throws com.ollamahub.orchestration.exception.MalformedResponseException when a 2xx reply has no content.
     */
    String chat(AgentConfig agent, List<ConversationMessage> messages);
}
