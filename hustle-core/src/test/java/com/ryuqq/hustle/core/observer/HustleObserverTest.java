package com.ryuqq.hustle.core.observer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HustleObserver 기본 구현 테스트.
 *
 * @author Hustle Team
 * @since 1.0.0
 */
class HustleObserverTest {

    @Test
    void composite_MultipleObservers_DeliversInOrder() {
        // Given
        List<String> received = new ArrayList<>();
        HustleObserver first = event -> received.add("first:" + event.name());
        HustleObserver second = event -> received.add("second:" + event.name());

        // When
        HustleObserver.composite(first, second).onEvent(HustleEvent.of(HustleEvent.RUN_STARTED));

        // Then
        assertEquals(List.of("first:run.started", "second:run.started"), received);
    }

    @Test
    void composite_NullObserver_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> HustleObserver.composite(HustleObserver.noop(), null));
    }

    @Test
    void logging_Always_ReturnsSharedSlf4jObserver() {
        // When & Then
        assertSame(HustleObserver.logging(), HustleObserver.logging());
        assertDoesNotThrow(() -> HustleObserver.logging().onEvent(
            HustleEvent.of(HustleEvent.RETRY_EXHAUSTED, "operation", "op", "attempt", 3)));
    }

    @Test
    void render_Event_FormatsNameAndFields() {
        // Given
        HustleEvent event = HustleEvent.of(HustleEvent.RETRY_SCHEDULED, "operation", "Analyst", "attempt", 1);

        // When
        String line = Slf4jHustleObserver.render(event);

        // Then
        assertEquals("retry.scheduled operation=Analyst attempt=1", line);
    }
}
