package com.ryuqq.hustle.testkit;

import com.ryuqq.hustle.core.retry.RetryPolicy;
import com.ryuqq.hustle.core.state.StateEnvelope;
import com.ryuqq.hustle.core.task.InputContract;
import com.ryuqq.hustle.core.task.Move;
import com.ryuqq.hustle.core.task.MoveEmitter;
import com.ryuqq.hustle.core.task.WorkUnit;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for lambda-backed work units used in tests.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * List&lt;String&gt; trace = new ArrayList&lt;&gt;();
 * WorkUnit&lt;Map&lt;String, Object&gt;, Map&lt;String, Object&gt;, ?, ?&gt; a = TestUnits.tracing("A", trace, "left", "right");
 * a.link("left", TestUnits.tracing("B", trace));
 * a.link("right", TestUnits.tracing("C", trace));
 * </pre>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public final class TestUnits {

    private TestUnits() {
    }

    /**
     * Core operation of a lambda unit.
     *
     * @param <I> validated input type
     * @param <O> output type
     */
    @FunctionalInterface
    public interface Body<I, O> {
        O execute(I input) throws Exception;
    }

    /**
     * Delivery step of a lambda unit.
     *
     * @param <C> capital type
     * @param <T> change type
     * @param <I> validated input type
     * @param <O> output type
     */
    @FunctionalInterface
    public interface Delivery<C, T, I, O> {
        void deliver(StateEnvelope<C, T> envelope, I input, O output, MoveEmitter moves) throws Exception;
    }

    /**
     * Work unit whose execute and deliver steps are lambdas.
     *
     * @param <C> capital type
     * @param <T> change type
     * @param <I> validated input type
     * @param <O> output type
     */
    public static final class LambdaUnit<C, T, I, O> extends WorkUnit<C, T, I, O> {

        private final Body<I, O> body;
        private final Delivery<C, T, I, O> delivery;

        public LambdaUnit(String name, InputContract<I> contract, RetryPolicy retryPolicy, Set<String> routes,
                          Body<I, O> body, Delivery<C, T, I, O> delivery) {
            super(name, contract, retryPolicy, routes);
            if (body == null) {
                throw new IllegalArgumentException("body cannot be null");
            }
            this.body = body;
            this.delivery = delivery;
        }

        @Override
        protected O execute(I input) throws Exception {
            return body.execute(input);
        }

        @Override
        protected void deliver(StateEnvelope<C, T> envelope, I input, O output, MoveEmitter moves) throws Exception {
            if (delivery != null) {
                delivery.deliver(envelope, input, output, moves);
            }
        }
    }

    /**
     * Creates a fully specified lambda unit.
     */
    public static <C, T, I, O> LambdaUnit<C, T, I, O> unit(String name, InputContract<I> contract,
                                                          RetryPolicy retryPolicy, Set<String> routes,
                                                          Body<I, O> body, Delivery<C, T, I, O> delivery) {
        return new LambdaUnit<>(name, contract, retryPolicy, routes, body, delivery);
    }

    /**
     * Creates a unit that passes its change through and forwards.
     */
    public static <C, T> LambdaUnit<C, T, T, T> passThrough(String name) {
        return new LambdaUnit<>(name, null, RetryPolicy.none(), Set.of(Move.FORWARD), input -> input, null);
    }

    /**
     * Creates a unit that appends its name to {@code trace} on delivery and emits the given routes.
     *
     * <p>With no routes the unit declares only "forward" and emits nothing, relying on the default move.</p>
     */
    public static <C, T> LambdaUnit<C, T, T, T> tracing(String name, List<String> trace, String... emitRoutes) {
        Set<String> routes = emitRoutes.length == 0
            ? Set.of(Move.FORWARD)
            : new LinkedHashSet<>(Arrays.asList(emitRoutes));
        return new LambdaUnit<>(name, null, RetryPolicy.none(), routes, input -> input,
            (envelope, input, output, moves) -> {
                trace.add(name);
                for (String route : emitRoutes) {
                    moves.emit(route);
                }
            });
    }

    /**
     * Creates a unit whose execute step always throws {@code error}, without retries.
     */
    public static <C, T> LambdaUnit<C, T, T, T> failing(String name, Exception error) {
        return new LambdaUnit<>(name, null, RetryPolicy.none(), Set.of(Move.FORWARD), input -> {
            throw error;
        }, null);
    }

    /**
     * Creates a unit that fails {@code failures} times before returning its input.
     *
     * <p>Every execute call increments {@code calls}.</p>
     */
    public static <C, T> LambdaUnit<C, T, T, T> flaky(String name, int failures, RetryPolicy retryPolicy,
                                                     AtomicInteger calls) {
        return new LambdaUnit<>(name, null, retryPolicy, Set.of(Move.FORWARD), input -> {
            int call = calls.incrementAndGet();
            if (call <= failures) {
                throw new IllegalStateException("transient failure " + call);
            }
            return input;
        }, null);
    }
}
