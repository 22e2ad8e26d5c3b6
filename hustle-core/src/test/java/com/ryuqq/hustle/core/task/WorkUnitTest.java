package com.ryuqq.hustle.core.task;

import com.ryuqq.hustle.core.exception.RoutingException;
import com.ryuqq.hustle.core.exception.ValidationException;
import com.ryuqq.hustle.core.observer.HustleObserver;
import com.ryuqq.hustle.core.retry.RetryConfig;
import com.ryuqq.hustle.core.retry.RetryPolicy;
import com.ryuqq.hustle.core.state.StateEnvelope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

/**
 * WorkUnit 테스트.
 *
 * @author Hustle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WorkUnitTest {

    @Mock
    private InputContract<Object> contract;

    private final List<Duration> sleeps = new ArrayList<>();

    private final HustleObserver observer = HustleObserver.noop();

    record Pitch(String name) {
    }

    /**
     * deliver에서 아무 Move도 선언하지 않는 단위.
     */
    static class SilentUnit extends WorkUnit<List<String>, Object, Object, Object> {

        final AtomicInteger executions = new AtomicInteger();

        SilentUnit() {
            super(null, RetryPolicy.none());
        }

        SilentUnit(InputContract<Object> contract) {
            super(contract, RetryPolicy.none());
        }

        @Override
        protected Object execute(Object input) {
            executions.incrementAndGet();
            return input;
        }
    }

    /**
     * 입력 이름을 capital에 기록하고 "approve"/"reject"로 분기하는 단위.
     */
    static class ReviewUnit extends WorkUnit<List<String>, Object, Object, Boolean> {

        ReviewUnit() {
            super("Review", null, RetryPolicy.none(), Set.of("approve", "reject"));
        }

        @Override
        protected Boolean execute(Object input) {
            return input instanceof Pitch && ((Pitch) input).name().startsWith("F");
        }

        @Override
        protected void deliver(StateEnvelope<List<String>, Object> envelope, Object input, Boolean approved,
                               MoveEmitter moves) {
            envelope.capital().add(String.valueOf(input));
            moves.emit(approved ? "approve" : "reject", Map.of("approved", approved));
        }
    }

    private StateEnvelope<List<String>, Object> envelope(Object change) {
        return StateEnvelope.create(new ArrayList<>(), change);
    }

    @Test
    void step_NoMovesEmitted_ReturnsSingleDefaultForward() throws Exception {
        // Given
        SilentUnit unit = new SilentUnit();

        // When
        List<Move> moves = unit.step(envelope(Map.of()), observer);

        // Then
        assertEquals(1, moves.size());
        assertEquals("forward", moves.get(0).route());
        assertNull(moves.get(0).payload());
    }

    @Test
    void step_DeliverEmitsMove_ReturnsEmittedMoveAndMutatesCapital() throws Exception {
        // Given
        ReviewUnit unit = new ReviewUnit();
        StateEnvelope<List<String>, Object> envelope = envelope(new Pitch("Foo"));

        // When
        List<Move> moves = unit.step(envelope, observer);

        // Then
        assertEquals(List.of(Move.to("approve", Map.of("approved", true))), moves);
        assertEquals(List.of("Pitch[name=Foo]"), envelope.capital());
    }

    @Test
    void step_StructuredChangeWithContract_SkipsValidation() throws Exception {
        // Given
        SilentUnit unit = new SilentUnit(contract);
        Pitch pitch = new Pitch("Foo");

        // When
        unit.step(envelope(pitch), observer);

        // Then
        verifyNoInteractions(contract);
        assertEquals(1, unit.executions.get());
    }

    @Test
    void step_MapChangeWithContract_PassesCoercedInputToExecute() throws Exception {
        // Given
        Pitch coerced = new Pitch("Foo");
        when(contract.validate(anyMap())).thenReturn(coerced);
        List<Object> received = new ArrayList<>();
        WorkUnit<List<String>, Object, Object, Object> unit =
            new WorkUnit<>(contract, RetryPolicy.none()) {
                @Override
                protected Object execute(Object input) {
                    received.add(input);
                    return input;
                }
            };

        // When
        unit.step(envelope(new LinkedHashMap<>(Map.of("name", "Foo"))), observer);

        // Then
        verify(contract).validate(Map.of("name", "Foo"));
        assertEquals(List.of(coerced), received);
    }

    @Test
    void step_ValidationFails_PropagatesWithoutExecuting() {
        // Given
        when(contract.validate(anyMap())).thenThrow(new ValidationException("name: required field is missing"));
        SilentUnit unit = new SilentUnit(contract);

        // When & Then
        assertThrows(ValidationException.class, () -> unit.step(envelope(new LinkedHashMap<>()), observer));
        assertEquals(0, unit.executions.get());
    }

    @Test
    void step_NullChangeWithRequiredFieldContract_ThrowsValidationException() {
        // Given
        AtomicInteger executions = new AtomicInteger();
        MapSchemaContract schema = MapSchemaContract.builder()
            .required("name", String.class)
            .build();
        WorkUnit<List<String>, Object, Map<String, Object>, Object> unit =
            new WorkUnit<>(schema, RetryPolicy.none()) {
                @Override
                protected Object execute(Map<String, Object> input) {
                    executions.incrementAndGet();
                    return input;
                }
            };

        // When & Then
        assertThrows(ValidationException.class, () -> unit.step(envelope(null), observer));
        assertEquals(0, executions.get());
    }

    @Test
    void step_NullChangeWithoutContract_PassesNullToExecute() throws Exception {
        // Given
        SilentUnit unit = new SilentUnit();

        // When
        List<Move> moves = unit.step(envelope(null), observer);

        // Then
        assertEquals(1, unit.executions.get());
        assertEquals(List.of(Move.forward()), moves);
    }

    @Test
    void step_ExecuteFailsTransiently_RetriesThenDelivers() throws Exception {
        // Given
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy retry = new RetryPolicy(RetryConfig.of(3, Duration.ofMillis(10)), sleeps::add);
        WorkUnit<List<String>, Object, Object, String> unit =
            new WorkUnit<>(null, retry) {
                @Override
                protected String execute(Object input) throws IOException {
                    if (calls.incrementAndGet() < 3) {
                        throw new IOException("timeout");
                    }
                    return "ok";
                }

                @Override
                protected void deliver(StateEnvelope<List<String>, Object> envelope, Object input, String output,
                                       MoveEmitter moves) {
                    envelope.capital().add(output);
                }
            };
        StateEnvelope<List<String>, Object> envelope = envelope(null);

        // When
        unit.step(envelope, observer);

        // Then
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
        assertEquals(List.of("ok"), envelope.capital());
    }

    @Test
    void step_ExecuteExhausted_ThrowsOriginalCheckedException() {
        // Given
        IOException failure = new IOException("down");
        WorkUnit<List<String>, Object, Object, Object> unit =
            new WorkUnit<>(null, new RetryPolicy(RetryConfig.of(2, Duration.ZERO), sleeps::add)) {
                @Override
                protected Object execute(Object input) throws IOException {
                    throw failure;
                }
            };

        // When
        IOException thrown = assertThrows(IOException.class, () -> unit.step(envelope(null), observer));

        // Then
        assertSame(failure, thrown);
    }

    @Test
    void step_DeliverFails_IsNotRetried() {
        // Given
        AtomicInteger executions = new AtomicInteger();
        WorkUnit<List<String>, Object, Object, Object> unit =
            new WorkUnit<>(null, new RetryPolicy(RetryConfig.of(4, Duration.ZERO), sleeps::add)) {
                @Override
                protected Object execute(Object input) {
                    return executions.incrementAndGet();
                }

                @Override
                protected void deliver(StateEnvelope<List<String>, Object> envelope, Object input, Object output,
                                       MoveEmitter moves) {
                    throw new IllegalStateException("delivery failed");
                }
            };

        // When & Then
        assertThrows(IllegalStateException.class, () -> unit.step(envelope(null), observer));
        assertEquals(1, executions.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void step_NullEnvelope_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new SilentUnit().step(null, observer)
        );
        assertTrue(exception.getMessage().contains("envelope cannot be null"));
    }

    @Test
    void link_DeclaredRoute_RegistersSuccessor() {
        // Given
        ReviewUnit review = new ReviewUnit();
        SilentUnit approved = new SilentUnit();

        // When
        review.link("approve", approved);

        // Then
        assertSame(approved, review.successor("approve").orElseThrow());
        assertTrue(review.successor("reject").isEmpty());
        assertEquals(Set.of("approve"), review.links().keySet());
    }

    @Test
    void link_UndeclaredRoute_ThrowsRoutingException() {
        // When & Then
        RoutingException exception = assertThrows(
            RoutingException.class,
            () -> new ReviewUnit().link("forward", new SilentUnit())
        );
        assertTrue(exception.getMessage().contains("not declared by Review"));
    }

    @Test
    void link_NullSuccessor_ThrowsRoutingException() {
        // When & Then
        RoutingException exception = assertThrows(
            RoutingException.class,
            () -> new SilentUnit().link("forward", null)
        );
        assertTrue(exception.getMessage().contains("null successor"));
    }

    @Test
    void link_SameRouteTwice_LastLinkWins() {
        // Given
        SilentUnit unit = new SilentUnit();
        SilentUnit first = new SilentUnit();
        SilentUnit second = new SilentUnit();

        // When
        unit.link("forward", first).link("forward", second);

        // Then
        assertSame(second, unit.successor("forward").orElseThrow());
    }

    @Test
    void then_Chain_LinksForwardAndReturnsNext() {
        // Given
        SilentUnit a = new SilentUnit();
        SilentUnit b = new SilentUnit();
        SilentUnit c = new SilentUnit();

        // When
        SilentUnit tail = a.then(b).then(c);

        // Then
        assertSame(c, tail);
        assertSame(b, a.successor("forward").orElseThrow());
        assertSame(c, b.successor("forward").orElseThrow());
    }

    @Test
    void constructor_EmptyRoutes_ThrowsRoutingException() {
        // When & Then
        assertThrows(RoutingException.class, () -> new WorkUnit<Object, Object, Object, Object>(
            "Empty", null, RetryPolicy.none(), Set.of()) {
            @Override
            protected Object execute(Object input) {
                return input;
            }
        });
    }

    @Test
    void constructor_NullRetryPolicy_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new WorkUnit<Object, Object, Object, Object>(
            null, null) {
            @Override
            protected Object execute(Object input) {
                return input;
            }
        });
    }

    @Test
    void name_NotGiven_DefaultsToClassName() {
        // When & Then
        assertEquals("SilentUnit", new SilentUnit().name());
        assertEquals("Review", new ReviewUnit().name());
        assertEquals(Set.of("forward"), new SilentUnit().routes());
    }
}
