package com.ryuqq.hustle.core.task;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 한 번의 step 동안 선언된 Move를 모으는 버퍼.
 */
final class MoveBuffer implements MoveEmitter {

    private final List<Move> moves = new ArrayList<>();

    @Override
    public void emit(String route, Map<String, Object> payload) {
        moves.add(new Move(route, payload));
    }

    /**
     * 선언된 Move 목록 확정 (없으면 기본 Move 하나).
     *
     * @return 비어있지 않은 불변 목록
     */
    List<Move> finish() {
        if (moves.isEmpty()) {
            return List.of(Move.forward());
        }
        return List.copyOf(moves);
    }
}
