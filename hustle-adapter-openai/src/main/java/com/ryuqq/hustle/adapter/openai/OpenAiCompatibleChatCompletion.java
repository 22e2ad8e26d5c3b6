package com.ryuqq.hustle.adapter.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.hustle.core.spi.ChatCompletion;
import com.ryuqq.hustle.core.spi.ChatCompletionException;
import com.ryuqq.hustle.core.spi.ChatMessage;
import com.ryuqq.hustle.core.spi.ChatOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * OpenAI 호환 chat-completions 클라이언트.
 *
 * <p>{@code POST {baseUrl}/chat/completions}로 요청하고
 * {@code choices[0].message.content}를 반환합니다.</p>
 *
 * <p><strong>실패 처리:</strong> 다음 경우 future가 {@link ChatCompletionException}으로 완료됩니다.</p>
 * <ul>
 *   <li>전송 실패 (statusCode -1)</li>
 *   <li>2xx가 아닌 응답 (응답 status 보존)</li>
 *   <li>JSON이 아니거나 choices/content가 비어있는 응답</li>
 * </ul>
 *
 * <p>재시도는 하지 않습니다. 호출하는 작업 단위의 RetryPolicy가 담당합니다.</p>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public class OpenAiCompatibleChatCompletion implements ChatCompletion {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleChatCompletion.class);

    private static final int BODY_PREVIEW_LIMIT = 500;

    private final ChatEndpointConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    /**
     * 생성자 (기본 HttpClient, ObjectMapper).
     *
     * @param config 엔드포인트 설정
     */
    public OpenAiCompatibleChatCompletion(ChatEndpointConfig config) {
        this(config, defaultHttpClient(config), new ObjectMapper());
    }

    private static HttpClient defaultHttpClient(ChatEndpointConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return HttpClient.newBuilder()
            .connectTimeout(config.requestTimeout())
            .build();
    }

    /**
     * 생성자 (의존성 주입).
     *
     * @param config 엔드포인트 설정
     * @param httpClient HTTP 클라이언트
     * @param mapper ObjectMapper
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public OpenAiCompatibleChatCompletion(ChatEndpointConfig config, HttpClient httpClient, ObjectMapper mapper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.config = config;
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    /**
     * 제공자 환경 변수로 클라이언트 생성.
     *
     * @param provider 제공자
     * @return 클라이언트
     */
    public static OpenAiCompatibleChatCompletion forProvider(LlmProvider provider) {
        return new OpenAiCompatibleChatCompletion(ChatEndpointConfig.fromEnvironment(provider));
    }

    @Override
    public CompletableFuture<String> complete(List<ChatMessage> messages, String model, ChatOptions options) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages cannot be null or empty");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be null or blank");
        }
        ChatOptions effective = options == null ? ChatOptions.defaults() : options;

        HttpRequest request;
        try {
            request = buildRequest(messages, model, effective);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                new ChatCompletionException("Failed to serialize chat request", e)
            );
        }

        log.debug("Sending chat completion: url={}, model={}, messages={}",
            config.completionsUrl(), model, messages.size());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .handle((response, error) -> {
                if (error != null) {
                    throw new ChatCompletionException(
                        "Chat request to " + config.completionsUrl() + " failed", unwrap(error)
                    );
                }
                return parse(response);
            });
    }

    HttpRequest buildRequest(List<ChatMessage> messages, String model, ChatOptions options)
        throws JsonProcessingException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);

        ArrayNode array = payload.putArray("messages");
        for (ChatMessage message : messages) {
            ObjectNode node = array.addObject();
            node.put("role", message.role());
            node.put("content", message.content());
        }

        if (options.temperature() != null) {
            payload.put("temperature", options.temperature());
        }
        if (options.maxTokens() != null) {
            payload.put("max_tokens", options.maxTokens());
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(config.completionsUrl()))
            .timeout(config.requestTimeout())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));

        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        for (Map.Entry<String, String> header : config.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private String parse(HttpResponse<String> response) {
        int status = response.statusCode();
        String body = response.body();
        if (status < 200 || status >= 300) {
            throw new ChatCompletionException(
                "Chat request failed (" + status + "): " + preview(body), status, null
            );
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ChatCompletionException("Chat response is not valid JSON: " + preview(body), status, e);
        }

        JsonNode choices = root == null ? null : root.path("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new ChatCompletionException("Chat response has no choices: " + preview(body), status, null);
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ChatCompletionException("Chat response has no message content: " + preview(body), status, null);
        }
        return content.asText();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static String preview(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= BODY_PREVIEW_LIMIT ? body : body.substring(0, BODY_PREVIEW_LIMIT) + "...";
    }

    /**
     * 엔드포인트 설정 조회.
     *
     * @return 설정
     */
    public ChatEndpointConfig config() {
        return config;
    }
}
