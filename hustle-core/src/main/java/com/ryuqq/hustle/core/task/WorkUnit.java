package com.ryuqq.hustle.core.task;

import com.ryuqq.hustle.core.exception.RoutingException;
import com.ryuqq.hustle.core.observer.HustleObserver;
import com.ryuqq.hustle.core.retry.RetryPolicy;
import com.ryuqq.hustle.core.state.StateEnvelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 워크플로우 그래프의 작업 단위 (task).
 *
 * <p>한 번의 step은 네 단계로 구성됩니다:</p>
 * <ol>
 *   <li><strong>Validate:</strong> 입력 계약이 있고 change가 Map 또는 null이면 계약으로 검증/변환.
 *       change가 이미 구조화된 값이면 계약이 있어도 검증을 건너뜀 (상류에서 검증된 값으로 간주)</li>
 *   <li><strong>Execute:</strong> {@link #execute(Object)}를 RetryPolicy로 감싸 실행</li>
 *   <li><strong>Deliver:</strong> {@link #deliver}에서 capital/change 갱신 및 Move 선언</li>
 *   <li><strong>Finalize:</strong> 선언된 Move가 없으면 기본 Move("forward") 하나를 반환</li>
 * </ol>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>ValidationException: 재시도 없이 즉시 전파</li>
 *   <li>execute 실패: RetryPolicy에 따라 재시도 후, 소진되면 원래 예외 그대로 전파</li>
 *   <li>deliver 실패: 재시도 없이 즉시 전파</li>
 * </ul>
 *
 * <p><strong>라우팅:</strong> 작업 단위가 사용할 route 이름은 생성 시점에 고정되며
 * (기본값 {"forward"}), {@link #link}는 선언되지 않은 route를 거부합니다.
 * 링크 테이블은 run 시작 전에 구성하고 실행 중에는 변경하지 않아야 합니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * class Analyst extends WorkUnit&lt;Firm, Map&lt;String, Object&gt;, Map&lt;String, Object&gt;, String&gt; {
 *
 *     Analyst() {
 *         super(MapSchemaContract.builder().required("idea", String.class).build());
 *     }
 *
 *     {@literal @}Override
 *     protected String execute(Map&lt;String, Object&gt; deck) throws Exception {
 *         return chat.completeSync(List.of(ChatMessage.user("Idea: " + deck.get("idea"))), model);
 *     }
 *
 *     {@literal @}Override
 *     protected void deliver(StateEnvelope&lt;Firm, Map&lt;String, Object&gt;&gt; envelope,
 *                            Map&lt;String, Object&gt; deck, String analysis, MoveEmitter moves) {
 *         moves.forward(Map.of("analysis", analysis));
 *     }
 * }
 * </pre>
 *
 * @param <C> capital 타입
 * @param <T> change 타입
 * @param <I> 검증된 입력 타입
 * @param <O> execute 결과 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public abstract class WorkUnit<C, T, I, O> {

    private final String name;
    private final InputContract<I> contract;
    private final RetryPolicy retryPolicy;
    private final Set<String> routes;
    private final Map<String, WorkUnit<C, T, ?, ?>> links = new LinkedHashMap<>();

    /**
     * 생성자 (계약 없음, 기본 재시도 정책, route {"forward"}).
     */
    protected WorkUnit() {
        this(null, null, RetryPolicy.defaults(), Set.of(Move.FORWARD));
    }

    /**
     * 생성자 (입력 계약 지정).
     *
     * @param contract 입력 계약 (null 가능)
     */
    protected WorkUnit(InputContract<I> contract) {
        this(null, contract, RetryPolicy.defaults(), Set.of(Move.FORWARD));
    }

    /**
     * 생성자 (입력 계약, 재시도 정책 지정).
     *
     * @param contract 입력 계약 (null 가능)
     * @param retryPolicy 재시도 정책
     */
    protected WorkUnit(InputContract<I> contract, RetryPolicy retryPolicy) {
        this(null, contract, retryPolicy, Set.of(Move.FORWARD));
    }

    /**
     * 전체 생성자.
     *
     * @param name 작업 단위 이름 (null이면 클래스 이름)
     * @param contract 입력 계약 (null 가능)
     * @param retryPolicy 재시도 정책
     * @param routes 선언할 route 이름 목록 (비어있지 않아야 함)
     * @throws IllegalArgumentException retryPolicy가 null인 경우
     * @throws RoutingException routes가 비어있거나 빈 이름을 포함한 경우
     */
    protected WorkUnit(String name, InputContract<I> contract, RetryPolicy retryPolicy, Set<String> routes) {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (routes == null || routes.isEmpty()) {
            throw new RoutingException("routes cannot be null or empty");
        }
        for (String route : routes) {
            if (route == null || route.isBlank()) {
                throw new RoutingException("route names cannot be null or blank (routes: " + routes + ")");
            }
        }
        this.name = (name == null || name.isBlank()) ? defaultName() : name;
        this.contract = contract;
        this.retryPolicy = retryPolicy;
        this.routes = Collections.unmodifiableSet(new LinkedHashSet<>(routes));
    }

    /**
     * 핵심 작업 실행.
     *
     * <p>RetryPolicy로 감싸져 호출되므로 일시적 실패는 예외로 던지면 됩니다.
     * 외부 호출(예: ChatCompletion)을 수행할 수 있습니다.</p>
     *
     * @param input 검증된 입력
     * @return 실행 결과
     * @throws Exception 실행 실패 시
     */
    protected abstract O execute(I input) throws Exception;

    /**
     * 결과 전달 (부수 효과 + 라우팅 선언).
     *
     * <p>capital을 제자리에서 변경하거나, 이 분기의 change를 변경하고,
     * {@code moves}로 0개 이상의 Move를 선언할 수 있습니다. 기본 구현은 아무것도 하지 않습니다.</p>
     *
     * @param envelope 현재 봉투
     * @param input 검증된 입력
     * @param output execute 결과
     * @param moves Move 선언 수단
     * @throws Exception 전달 실패 시 (재시도되지 않음)
     */
    protected void deliver(StateEnvelope<C, T> envelope, I input, O output, MoveEmitter moves) throws Exception {
        // 기본: 아무것도 하지 않음 → forward
    }

    /**
     * step 실행 (기본 SLF4J Observer 사용).
     *
     * @param envelope 현재 봉투
     * @return 비어있지 않은 Move 목록
     * @throws Exception validate/execute/deliver 실패 시 원래 예외
     */
    public final List<Move> step(StateEnvelope<C, T> envelope) throws Exception {
        return step(envelope, HustleObserver.logging());
    }

    /**
     * step 실행: validate → execute(재시도) → deliver → finalize.
     *
     * @param envelope 현재 봉투
     * @param observer 재시도 이벤트 수신자
     * @return 비어있지 않은 Move 목록
     * @throws IllegalArgumentException envelope 또는 observer가 null인 경우
     * @throws com.ryuqq.hustle.core.exception.ValidationException 입력 계약 위반 시
     * @throws Exception execute 재시도 소진 또는 deliver 실패 시 원래 예외
     */
    public final List<Move> step(StateEnvelope<C, T> envelope, HustleObserver observer) throws Exception {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }

        // 1. Validate
        I input = validate(envelope.change());

        // 2. Execute (재시도)
        O output = retryPolicy.execute(name, () -> execute(input), observer).getOrThrow();

        // 3. Deliver
        MoveBuffer moves = new MoveBuffer();
        deliver(envelope, input, output, moves);

        // 4. Finalize
        return moves.finish();
    }

    @SuppressWarnings("unchecked")
    private I validate(T change) {
        if (contract != null && (change == null || change instanceof Map)) {
            return contract.validate((Map<String, Object>) change);
        }
        return (I) change;
    }

    /**
     * route에 후속 작업 단위 연결.
     *
     * <p>같은 route를 다시 연결하면 이전 연결을 대체합니다.</p>
     *
     * @param route 선언된 route 이름
     * @param next 후속 작업 단위
     * @return this (연속 연결용)
     * @throws RoutingException next가 null이거나 route가 선언되지 않은 경우
     */
    public WorkUnit<C, T, I, O> link(String route, WorkUnit<C, T, ?, ?> next) {
        if (next == null) {
            throw new RoutingException("Cannot link " + name + " to a null successor (route: " + route + ")");
        }
        if (route == null || !routes.contains(route)) {
            throw new RoutingException(
                "Route '" + route + "' is not declared by " + name + " (declared: " + routes + ")"
            );
        }
        links.put(route, next);
        return this;
    }

    /**
     * "forward" route로 후속 작업 단위 연결.
     *
     * <p>{@code a.then(b).then(c)} 형태의 체인 구성을 위해 next를 반환합니다.</p>
     *
     * @param next 후속 작업 단위
     * @param <N> 후속 작업 단위 타입
     * @return next
     * @throws RoutingException next가 null이거나 "forward"가 선언되지 않은 경우
     */
    public <N extends WorkUnit<C, T, ?, ?>> N then(N next) {
        link(Move.FORWARD, next);
        return next;
    }

    /**
     * route에 연결된 후속 작업 단위 조회.
     *
     * @param route route 이름
     * @return 후속 작업 단위 (연결 없으면 empty)
     */
    public Optional<WorkUnit<C, T, ?, ?>> successor(String route) {
        return Optional.ofNullable(links.get(route));
    }

    /**
     * 링크 테이블 조회.
     *
     * @return 불변 링크 테이블 (연결 순서 유지)
     */
    public Map<String, WorkUnit<C, T, ?, ?>> links() {
        return Collections.unmodifiableMap(links);
    }

    /**
     * 선언된 route 이름 조회.
     *
     * @return 불변 route 집합
     */
    public Set<String> routes() {
        return routes;
    }

    /**
     * 작업 단위 이름 조회.
     *
     * @return 이름
     */
    public String name() {
        return name;
    }

    /**
     * 재시도 정책 조회.
     *
     * @return 재시도 정책
     */
    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    public String toString() {
        return "WorkUnit{" + name + ", routes=" + routes + ", linked=" + links.keySet() + '}';
    }

    private String defaultName() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }
}
