package com.ryuqq.hustle.runner;

import com.ryuqq.hustle.core.exception.ConfigurationException;
import com.ryuqq.hustle.core.exception.RoutingException;
import com.ryuqq.hustle.core.observer.HustleEvent;
import com.ryuqq.hustle.core.observer.HustleObserver;
import com.ryuqq.hustle.core.retry.RetryPolicy;
import com.ryuqq.hustle.core.state.StateEnvelope;
import com.ryuqq.hustle.core.task.MoveEmitter;
import com.ryuqq.hustle.core.task.WorkUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Hustle 유닛 테스트.
 *
 * <p>Hustle의 핵심 동작을 검증합니다:</p>
 * <ul>
 *   <li>너비 우선 순서: 깊이 d의 단위가 모두 깊이 d+1보다 먼저 실행</li>
 *   <li>Move 해석: 링크 있음 → fork 후 enqueue, 링크 없음 → 분기 종료</li>
 *   <li>실패 처리: ABORT_RUN은 원래 예외 전파, CONTAIN_BRANCH는 분기만 종료</li>
 *   <li>이벤트 순서: run.started → unit.started → unit.completed → run.completed</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class HustleTest {

    @Mock
    private HustleObserver observer;

    private List<String> executed;
    private Map<String, Object> capital;

    /**
     * 실행 순서를 기록하고 지정된 route를 emit하는 테스트 단위.
     */
    private class Node extends WorkUnit<Map<String, Object>, Map<String, Object>, Map<String, Object>, Object> {

        private final String[] emits;
        private final RuntimeException failure;

        Node(String name, String... emits) {
            this(name, null, emits);
        }

        Node(String name, RuntimeException failure, String... emits) {
            super(name, null, RetryPolicy.none(), routesOf(emits));
            this.emits = emits;
            this.failure = failure;
        }

        @Override
        protected Object execute(Map<String, Object> input) {
            if (failure != null) {
                throw failure;
            }
            return input;
        }

        @Override
        protected void deliver(StateEnvelope<Map<String, Object>, Map<String, Object>> envelope,
                               Map<String, Object> input, Object output, MoveEmitter moves) {
            executed.add(name());
            for (String route : emits) {
                moves.emit(route);
            }
        }
    }

    private static Set<String> routesOf(String[] emits) {
        return emits.length == 0 ? Set.of("forward") : new LinkedHashSet<>(Arrays.asList(emits));
    }

    @BeforeEach
    void setUp() {
        executed = new ArrayList<>();
        capital = new LinkedHashMap<>();
    }

    // ============================================================
    // 1. 순회 순서
    // ============================================================

    @Test
    void start_깊이_순서대로_너비_우선_실행됨() throws Exception {
        // given: A → (B, C), B → D, C → E
        Node a = new Node("A", "left", "right");
        Node b = new Node("B");
        Node c = new Node("C");
        a.link("left", b).link("right", c);
        b.then(new Node("D"));
        c.then(new Node("E"));

        // when
        RunSummary summary = new Hustle<>(a, new HustleConfig(), observer).start(capital, new LinkedHashMap<>());

        // then
        assertThat(executed).containsExactly("A", "B", "C", "D", "E");
        assertThat(summary.stepsExecuted()).isEqualTo(5);
        assertThat(summary.branchesTerminated()).isEqualTo(2);
        assertThat(summary.isClean()).isTrue();
    }

    @Test
    void start_fan_in_단위는_들어오는_edge마다_실행됨() throws Exception {
        // given: A → (B, C), B → D, C → D
        Node a = new Node("A", "left", "right");
        Node b = new Node("B");
        Node c = new Node("C");
        Node d = new Node("D");
        a.link("left", b).link("right", c);
        b.then(d);
        c.then(d);

        // when
        new Hustle<>(a, new HustleConfig(), observer).start(capital, new LinkedHashMap<>());

        // then
        assertThat(executed).containsExactly("A", "B", "C", "D", "D");
    }

    @Test
    void start_분기마다_route_라벨로_lineage가_확장됨() throws Exception {
        // given
        Node a = new Node("A", "left", "right");
        a.link("left", new Node("B"));
        a.link("right", new Node("C"));

        // when
        new Hustle<>(a, new HustleConfig(), observer).start(capital, new LinkedHashMap<>());

        // then
        ArgumentCaptor<HustleEvent> events = ArgumentCaptor.forClass(HustleEvent.class);
        verify(observer, atLeastOnce()).onEvent(events.capture());
        List<Object> lineages = events.getAllValues().stream()
            .filter(e -> e.name().equals(HustleEvent.UNIT_STARTED))
            .map(e -> e.field("lineage"))
            .toList();
        assertThat(lineages).containsExactly("root", "root/left-1", "root/right-2");
    }

    // ============================================================
    // 2. 이벤트
    // ============================================================

    @Test
    void start_정상_종료_시_이벤트가_순서대로_방출됨() throws Exception {
        // given
        Node a = new Node("A");

        // when
        new Hustle<>(a, new HustleConfig(), observer).start(capital, new LinkedHashMap<>());

        // then
        InOrder inOrder = inOrder(observer);
        inOrder.verify(observer).onEvent(argThat(e -> e.name().equals(HustleEvent.RUN_STARTED)));
        inOrder.verify(observer).onEvent(argThat(e -> e.name().equals(HustleEvent.UNIT_STARTED)
            && "A".equals(e.field("unit"))));
        inOrder.verify(observer).onEvent(argThat(e -> e.name().equals(HustleEvent.UNIT_COMPLETED)
            && List.of("forward").equals(e.field("routes"))));
        inOrder.verify(observer).onEvent(argThat(e -> e.name().equals(HustleEvent.BRANCH_TERMINATED)
            && "forward".equals(e.field("route"))));
        inOrder.verify(observer).onEvent(argThat(e -> e.name().equals(HustleEvent.RUN_COMPLETED)
            && Long.valueOf(1).equals(e.field("steps"))));
        inOrder.verifyNoMoreInteractions();
    }

    // ============================================================
    // 3. 실패 처리
    // ============================================================

    @Test
    void start_ABORT_RUN_모드에서_실패하면_원래_예외가_전파되고_남은_분기는_실행_안_됨() {
        // given
        IllegalStateException failure = new IllegalStateException("analyst crashed");
        Node a = new Node("A", "left", "right");
        a.link("left", new Node("B", failure));
        a.link("right", new Node("C"));

        // when & then
        assertThatThrownBy(() -> new Hustle<>(a, new HustleConfig(), observer).start(capital, new LinkedHashMap<>()))
            .isSameAs(failure);
        assertThat(executed).containsExactly("A");
        verify(observer).onEvent(argThat(e -> e.name().equals(HustleEvent.RUN_ABORTED)
            && "B".equals(e.field("unit"))));
        verify(observer, never()).onEvent(argThat(e -> e.name().equals(HustleEvent.RUN_COMPLETED)));
    }

    @Test
    void start_CONTAIN_BRANCH_모드에서_실패한_분기만_종료됨() throws Exception {
        // given
        IllegalStateException failure = new IllegalStateException("analyst crashed");
        Node a = new Node("A", "left", "right");
        Node c = new Node("C");
        a.link("left", new Node("B", failure));
        a.link("right", c);
        c.then(new Node("D"));
        HustleConfig config = new HustleConfig().withFailureMode(FailureMode.CONTAIN_BRANCH);

        // when
        RunSummary summary = new Hustle<>(a, config, observer).start(capital, new LinkedHashMap<>());

        // then
        assertThat(executed).containsExactly("A", "C", "D");
        assertThat(summary.isClean()).isFalse();
        assertThat(summary.failures()).hasSize(1);
        BranchFailure branchFailure = summary.failures().get(0);
        assertThat(branchFailure.unit()).isEqualTo("B");
        assertThat(branchFailure.lineage()).isEqualTo("root/left-1");
        assertThat(branchFailure.error()).isSameAs(failure);
        verify(observer).onEvent(argThat(e -> e.name().equals(HustleEvent.BRANCH_FAILED)));
    }

    @Test
    void start_maxSteps_초과_시_IllegalStateException() {
        // given: A ↔ B 순환
        Node a = new Node("A");
        Node b = new Node("B");
        a.then(b);
        b.then(a);
        HustleConfig config = new HustleConfig().withMaxSteps(5);

        // when & then
        assertThatThrownBy(() -> new Hustle<>(a, config, observer).start(capital, new LinkedHashMap<>()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Step budget exhausted after 5 steps");
        assertThat(executed).containsExactly("A", "B", "A", "B", "A");
    }

    @Test
    void start_복사할_수_없는_change는_fork_시점에_run_중단() {
        // given
        Node a = new Node("A");
        a.then(new Node("B"));
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("socket", new Object());

        // when & then
        assertThatThrownBy(() -> new Hustle<>(a, new HustleConfig(), observer).start(capital, change))
            .isInstanceOf(ConfigurationException.class);
        assertThat(executed).containsExactly("A");
        verify(observer).onEvent(argThat(e -> e.name().equals(HustleEvent.RUN_ABORTED)));
    }

    // ============================================================
    // 4. 생성 및 인자 검증
    // ============================================================

    @Test
    void 생성자_entry가_null이면_RoutingException() {
        // when & then
        assertThatThrownBy(() -> new Hustle<Map<String, Object>, Map<String, Object>>(null))
            .isInstanceOf(RoutingException.class)
            .hasMessageContaining("entry unit");
    }

    @Test
    void 생성자_observer가_null이면_IllegalArgumentException() {
        // when & then
        assertThatThrownBy(() -> new Hustle<>(new Node("A"), new HustleConfig(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("observer cannot be null");
    }

    @Test
    void start_capital이_null이면_IllegalArgumentException() {
        // when & then
        assertThatThrownBy(() -> new Hustle<>(new Node("A"), new HustleConfig(), observer)
            .start(null, new LinkedHashMap<>()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capital cannot be null");
        verifyNoInteractions(observer);
    }

    @Test
    void run_사용자_지정_root_태그로_시작됨() throws Exception {
        // given
        Node a = new Node("A");
        StateEnvelope<Map<String, Object>, Map<String, Object>> root =
            StateEnvelope.create(capital, new LinkedHashMap<>(), "deal-42");

        // when
        new Hustle<>(a, new HustleConfig(), observer).run(root);

        // then
        verify(observer).onEvent(argThat(e -> e.name().equals(HustleEvent.RUN_STARTED)
            && "deal-42".equals(e.field("lineage"))));
    }
}
