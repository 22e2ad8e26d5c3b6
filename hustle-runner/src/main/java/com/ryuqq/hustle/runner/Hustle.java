package com.ryuqq.hustle.runner;

import com.ryuqq.hustle.core.exception.RoutingException;
import com.ryuqq.hustle.core.observer.HustleEvent;
import com.ryuqq.hustle.core.observer.HustleObserver;
import com.ryuqq.hustle.core.state.ChangeCopier;
import com.ryuqq.hustle.core.state.DefaultChangeCopier;
import com.ryuqq.hustle.core.state.StateEnvelope;
import com.ryuqq.hustle.core.task.Move;
import com.ryuqq.hustle.core.task.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 큐 기반 작업 단위 그래프 스케줄러 (hustle).
 *
 * <p>진입 작업 단위에서 시작하여 FIFO 큐로 그래프를 너비 우선 순회합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * start(capital, change)
 *   ↓
 * queue = [(entry, rootEnvelope)]
 *   ↓
 * while queue not empty:
 *   1. (unit, envelope) = queue.pollFirst()
 *   2. moves = unit.step(envelope)
 *   3. For each move:
 *      - 링크 있음 → queue.addLast((linked, envelope.fork(route, payload)))
 *      - 링크 없음 → 분기 종료 (정상 종료, 오류 아님)
 *   ↓
 * queue empty → RunSummary
 * </pre>
 *
 * <p><strong>순서 보장:</strong></p>
 * <ul>
 *   <li>깊이 d에 enqueue된 단위는 모두 깊이 d+1 단위보다 먼저 실행 (enqueue 순서)</li>
 *   <li>형제 분기 사이에는 enqueue 순서 외의 보장 없음</li>
 *   <li>여러 edge가 같은 단위를 가리키면 edge마다 독립적으로 한 번씩 실행 (join 없음)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>작업 단위는 한 번에 하나씩 순차 실행되므로 capital에 잠금이 필요 없음</li>
 *   <li>큐는 start 호출마다 새로 만들어지므로 인스턴스는 순차적으로 재사용 가능</li>
 *   <li>같은 capital을 공유하는 동시 start 호출의 동기화는 호출자 책임</li>
 * </ul>
 *
 * <p><strong>실패 전파:</strong> 기본(ABORT_RUN)에서는 첫 번째 미복구 오류가 원래 타입 그대로
 * start에서 전파되고 큐에 남은 분기는 실행되지 않습니다.
 * CONTAIN_BRANCH 모드는 {@link FailureMode} 참고.</p>
 *
 * @param <C> capital 타입
 * @param <T> change 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public final class Hustle<C, T> {

    private static final Logger log = LoggerFactory.getLogger(Hustle.class);

    private final WorkUnit<C, T, ?, ?> entry;
    private final HustleConfig config;
    private final HustleObserver observer;
    private final ChangeCopier copier;

    /**
     * 생성자 (기본 설정, SLF4J Observer).
     *
     * @param entry 진입 작업 단위
     * @throws RoutingException entry가 null인 경우
     */
    public Hustle(WorkUnit<C, T, ?, ?> entry) {
        this(entry, new HustleConfig());
    }

    /**
     * 생성자 (설정 지정, SLF4J Observer).
     *
     * @param entry 진입 작업 단위
     * @param config 설정
     * @throws RoutingException entry가 null인 경우
     * @throws IllegalArgumentException config가 null인 경우
     */
    public Hustle(WorkUnit<C, T, ?, ?> entry, HustleConfig config) {
        this(entry, config, HustleObserver.logging());
    }

    /**
     * 생성자 (설정, Observer 지정).
     *
     * @param entry 진입 작업 단위
     * @param config 설정
     * @param observer 이벤트 수신자
     * @throws RoutingException entry가 null인 경우
     * @throws IllegalArgumentException config 또는 observer가 null인 경우
     */
    public Hustle(WorkUnit<C, T, ?, ?> entry, HustleConfig config, HustleObserver observer) {
        this(entry, config, observer, DefaultChangeCopier.INSTANCE);
    }

    /**
     * 생성자 (change 복사 전략 주입).
     *
     * @param entry 진입 작업 단위
     * @param config 설정
     * @param observer 이벤트 수신자
     * @param copier root 봉투에 사용할 change 복사 전략
     * @throws RoutingException entry가 null인 경우
     * @throws IllegalArgumentException 그 외 의존성이 null인 경우
     */
    public Hustle(WorkUnit<C, T, ?, ?> entry, HustleConfig config, HustleObserver observer, ChangeCopier copier) {
        if (entry == null) {
            throw new RoutingException("Hustle requires an entry unit");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        if (copier == null) {
            throw new IllegalArgumentException("copier cannot be null");
        }
        this.entry = entry;
        this.config = config;
        this.observer = observer;
        this.copier = copier;
    }

    /**
     * run 시작.
     *
     * @param capital run 전체가 공유할 상태
     * @param change 진입 단위에 전달할 분기 상태 (null 가능)
     * @return run 요약
     * @throws IllegalArgumentException capital이 null인 경우
     * @throws Exception 미복구 오류 (원래 타입 그대로)
     */
    public RunSummary start(C capital, T change) throws Exception {
        if (capital == null) {
            throw new IllegalArgumentException("capital cannot be null");
        }
        return run(StateEnvelope.create(capital, change, StateEnvelope.ROOT_TAG, copier));
    }

    /**
     * 호출자가 만든 root 봉투로 run 시작.
     *
     * @param root root 봉투
     * @return run 요약
     * @throws IllegalArgumentException root가 null인 경우
     * @throws Exception 미복구 오류 (원래 타입 그대로)
     */
    public RunSummary run(StateEnvelope<C, T> root) throws Exception {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }

        Deque<Pending<C, T>> queue = new ArrayDeque<>();
        queue.addLast(new Pending<>(entry, root));
        observer.onEvent(HustleEvent.of(HustleEvent.RUN_STARTED,
            "entry", entry.name(),
            "lineage", root.lineage()));

        long steps = 0;
        long terminated = 0;
        List<BranchFailure> failures = new ArrayList<>();

        while (!queue.isEmpty()) {
            Pending<C, T> current = queue.pollFirst();
            WorkUnit<C, T, ?, ?> unit = current.unit();
            StateEnvelope<C, T> envelope = current.envelope();

            if (config.isStepLimited() && steps >= config.maxSteps()) {
                IllegalStateException exhausted = new IllegalStateException(
                    "Step budget exhausted after " + steps + " steps (" + (queue.size() + 1) + " branches pending)"
                );
                abort(unit, envelope, exhausted);
                throw exhausted;
            }

            steps++;
            observer.onEvent(HustleEvent.of(HustleEvent.UNIT_STARTED,
                "unit", unit.name(),
                "lineage", envelope.lineage()));

            List<Move> moves;
            try {
                moves = unit.step(envelope, observer);
            } catch (Exception e) {
                if (config.failureMode() == FailureMode.CONTAIN_BRANCH && !(e instanceof InterruptedException)) {
                    failures.add(new BranchFailure(unit.name(), envelope.lineage(), e));
                    observer.onEvent(HustleEvent.of(HustleEvent.BRANCH_FAILED,
                        "unit", unit.name(),
                        "lineage", envelope.lineage(),
                        "error", describe(e)));
                    continue;
                }
                abort(unit, envelope, e);
                throw e;
            }

            observer.onEvent(HustleEvent.of(HustleEvent.UNIT_COMPLETED,
                "unit", unit.name(),
                "lineage", envelope.lineage(),
                "routes", routesOf(moves)));

            try {
                terminated += dispatch(unit, envelope, moves, queue);
            } catch (RuntimeException e) {
                abort(unit, envelope, e);
                throw e;
            }
        }

        observer.onEvent(HustleEvent.of(HustleEvent.RUN_COMPLETED,
            "entry", entry.name(),
            "steps", steps,
            "terminated", terminated,
            "failures", failures.size()));
        return new RunSummary(steps, terminated, failures);
    }

    /**
     * Move를 링크 테이블로 해석하여 후속 분기 enqueue.
     *
     * @return 링크가 없어 종료된 분기 수
     */
    private long dispatch(WorkUnit<C, T, ?, ?> unit, StateEnvelope<C, T> envelope,
                          List<Move> moves, Deque<Pending<C, T>> queue) {
        long terminated = 0;
        for (Move move : moves) {
            Optional<WorkUnit<C, T, ?, ?>> next = unit.successor(move.route());
            if (next.isEmpty()) {
                terminated++;
                observer.onEvent(HustleEvent.of(HustleEvent.BRANCH_TERMINATED,
                    "unit", unit.name(),
                    "lineage", envelope.lineage(),
                    "route", move.route()));
                continue;
            }
            StateEnvelope<C, T> forked = envelope.fork(move.route(), move.payload());
            queue.addLast(new Pending<>(next.get(), forked));
            log.debug("Enqueued {} via '{}' as {}", next.get().name(), move.route(), forked.lineage());
        }
        return terminated;
    }

    private void abort(WorkUnit<C, T, ?, ?> unit, StateEnvelope<C, T> envelope, Exception e) {
        observer.onEvent(HustleEvent.of(HustleEvent.RUN_ABORTED,
            "unit", unit.name(),
            "lineage", envelope.lineage(),
            "error", describe(e)));
    }

    private static List<String> routesOf(List<Move> moves) {
        List<String> routes = new ArrayList<>(moves.size());
        for (Move move : moves) {
            routes.add(move.route());
        }
        return routes;
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    /**
     * 진입 작업 단위 조회.
     *
     * @return 진입 작업 단위
     */
    public WorkUnit<C, T, ?, ?> entry() {
        return entry;
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public HustleConfig config() {
        return config;
    }

    private record Pending<C, T>(WorkUnit<C, T, ?, ?> unit, StateEnvelope<C, T> envelope) {
    }
}
