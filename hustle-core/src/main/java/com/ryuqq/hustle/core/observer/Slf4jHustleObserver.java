package com.ryuqq.hustle.core.observer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * SLF4J로 이벤트를 기록하는 기본 Observer.
 *
 * <p>이벤트는 {@code name key=value ...} 한 줄로 렌더링됩니다.</p>
 *
 * <p><strong>로그 레벨:</strong></p>
 * <ul>
 *   <li>retry.scheduled → WARN</li>
 *   <li>retry.exhausted, run.aborted, branch.failed → ERROR</li>
 *   <li>branch.terminated → DEBUG</li>
 *   <li>그 외 → INFO</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public final class Slf4jHustleObserver implements HustleObserver {

    static final Slf4jHustleObserver INSTANCE =
        new Slf4jHustleObserver(LoggerFactory.getLogger(Slf4jHustleObserver.class));

    private static final Set<String> ERROR_EVENTS = Set.of(
        HustleEvent.RETRY_EXHAUSTED,
        HustleEvent.RUN_ABORTED,
        HustleEvent.BRANCH_FAILED
    );

    private final Logger log;

    Slf4jHustleObserver(Logger log) {
        this.log = log;
    }

    @Override
    public void onEvent(HustleEvent event) {
        if (ERROR_EVENTS.contains(event.name())) {
            if (log.isErrorEnabled()) {
                log.error("{}", render(event));
            }
        } else if (HustleEvent.RETRY_SCHEDULED.equals(event.name())) {
            if (log.isWarnEnabled()) {
                log.warn("{}", render(event));
            }
        } else if (HustleEvent.BRANCH_TERMINATED.equals(event.name())) {
            if (log.isDebugEnabled()) {
                log.debug("{}", render(event));
            }
        } else if (log.isInfoEnabled()) {
            log.info("{}", render(event));
        }
    }

    static String render(HustleEvent event) {
        StringBuilder sb = new StringBuilder(event.name());
        for (Map.Entry<String, Object> field : event.fields().entrySet()) {
            sb.append(' ').append(field.getKey()).append('=').append(field.getValue());
        }
        return sb.toString();
    }
}
