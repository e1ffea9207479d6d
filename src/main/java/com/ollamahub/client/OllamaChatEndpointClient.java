package com.ollamahub.client;

import com.ollamahub.orchestration.exception.MalformedResponseException;
import com.ollamahub.orchestration.model.AgentConfig;
import com.ollamahub.orchestration.model.ConversationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.stereotype.Component;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
public class OllamaChatEndpointClient implements ChatEndpointClient {

    private final RestClient.Builder restClientBuilder;
    private final ChatRequestFactoryProvider requestFactoryProvider;
    private final Map<Endpoint, OllamaApi> apis = new ConcurrentHashMap<>();

    public OllamaChatEndpointClient(RestClient.Builder restClientBuilder,
                                    ChatRequestFactoryProvider requestFactoryProvider) {
        this.restClientBuilder = restClientBuilder;
        this.requestFactoryProvider = requestFactoryProvider;
    }

    @Override
    public String chat(AgentConfig agent, List<ConversationMessage> messages) {
        OllamaApi api = apis.computeIfAbsent(new Endpoint(agent.baseUrl(), agent.timeout()), this::createApi);
        OllamaApi.ChatRequest request = OllamaApi.ChatRequest.builder(agent.model())
                .messages(messages.stream().map(OllamaChatEndpointClient::toOllamaMessage).toList())
                .stream(false)
                .build();
        OllamaApi.ChatResponse response = api.chat(request);
        if (response == null || response.message() == null || response.message().content() == null) {
            throw new MalformedResponseException("Response from " + agent.baseUrl() + " carried no message content");
        }
        return response.message().content();
    }

    private OllamaApi createApi(Endpoint endpoint) {
        log.debug("Creating Ollama client for {} with read timeout {}.", endpoint.baseUrl(), endpoint.readTimeout());
        RestClient.Builder builder = restClientBuilder.clone()
                .requestFactory(requestFactoryProvider.forReadTimeout(endpoint.readTimeout()));
        // Non-2xx replies surface as RestClientResponseException so they can be told apart from I/O failures.
        return OllamaApi.builder()
                .baseUrl(endpoint.baseUrl())
                .restClientBuilder(builder)
                .responseErrorHandler(new DefaultResponseErrorHandler())
                .build();
    }

    private static OllamaApi.Message toOllamaMessage(ConversationMessage message) {
        OllamaApi.Message.Role role = switch (message.role()) {
            case USER -> OllamaApi.Message.Role.USER;
            case ASSISTANT -> OllamaApi.Message.Role.ASSISTANT;
            case SYSTEM -> OllamaApi.Message.Role.SYSTEM;
        };
        return OllamaApi.Message.builder(role)
                .content(message.content())
                .build();
    }

    private record Endpoint(String baseUrl, Duration readTimeout) {
    }
}
