package com.ryuqq.hustle.core.spi;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Chat completion 협력자 SPI.
 *
 * <p>메시지 목록과 모델 식별자를 받아 비동기로 응답 텍스트를 반환합니다.
 * 엔진 코어는 이 형태에만 의존하며 특정 provider에 의존하지 않습니다.</p>
 *
 * <p><strong>사용 예시 (작업 단위 execute 안에서):</strong></p>
 * <pre>
 * String analysis = chat.completeSync(
 *     List.of(ChatMessage.system("You are a cynical VC analyst."),
 *             ChatMessage.user("Idea: " + idea)),
 *     model);
 * </pre>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public interface ChatCompletion {

    /**
     * 비동기 completion 요청.
     *
     * <p>provider 오류 시 반환된 future는 {@link ChatCompletionException}으로 실패합니다.</p>
     *
     * @param messages 순서가 있는 메시지 목록
     * @param model 모델 식별자
     * @param options 요청 옵션
     * @return 응답 텍스트 future
     */
    CompletableFuture<String> complete(List<ChatMessage> messages, String model, ChatOptions options);

    /**
     * 기본 옵션으로 비동기 completion 요청.
     *
     * @param messages 순서가 있는 메시지 목록
     * @param model 모델 식별자
     * @return 응답 텍스트 future
     */
    default CompletableFuture<String> complete(List<ChatMessage> messages, String model) {
        return complete(messages, model, ChatOptions.defaults());
    }

    /**
     * 동기 completion 요청 (응답까지 블로킹).
     *
     * <p>future 실패 원인이 ChatCompletionException이면 그대로 던지고,
     * 그 외 원인은 ChatCompletionException으로 감싸 던집니다.</p>
     *
     * @param messages 순서가 있는 메시지 목록
     * @param model 모델 식별자
     * @param options 요청 옵션
     * @return 응답 텍스트
     * @throws ChatCompletionException provider 오류 시
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    default String completeSync(List<ChatMessage> messages, String model, ChatOptions options)
        throws InterruptedException {
        try {
            return complete(messages, model, options).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ChatCompletionException) {
                throw (ChatCompletionException) cause;
            }
            throw new ChatCompletionException("Chat completion failed: " + cause, cause);
        }
    }

    /**
     * 기본 옵션으로 동기 completion 요청.
     *
     * @param messages 순서가 있는 메시지 목록
     * @param model 모델 식별자
     * @return 응답 텍스트
     * @throws ChatCompletionException provider 오류 시
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    default String completeSync(List<ChatMessage> messages, String model) throws InterruptedException {
        return completeSync(messages, model, ChatOptions.defaults());
    }
}
