package com.alonica.pos.application.hook;

import com.alonica.pos.domain.order.PaymentMethod;
import com.alonica.pos.domain.order.event.OrderPaidEvent;
import com.alonica.pos.domain.order.event.OrderServedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PostCommitHookDispatcher 테스트")
class PostCommitHookDispatcherTest {

    private static final OrderPaidEvent PAID = new OrderPaidEvent(1L, PaymentMethod.CASH, 50000L, LocalDateTime.now());

    /**
     * 호출 기록용 훅
     */
    private static class RecordingHook implements PostCommitHook<OrderPaidEvent> {
        private final String name;
        private final RuntimeException failure;
        private final String warning;
        private final List<String> calls;

        RecordingHook(String name, RuntimeException failure, String warning, List<String> calls) {
            this.name = name;
            this.failure = failure;
            this.warning = warning;
            this.calls = calls;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Class<OrderPaidEvent> getEventType() {
            return OrderPaidEvent.class;
        }

        @Override
        public Optional<String> handle(OrderPaidEvent event) {
            calls.add(name);
            if (failure != null) {
                throw failure;
            }
            return Optional.ofNullable(warning);
        }
    }

    @Test
    @DisplayName("한 훅의 실패가 다음 훅 실행을 막지 않고 경고로 반환")
    void testDispatch_FailureIsolated() {
        // Given
        List<String> calls = new ArrayList<>();
        PostCommitHookDispatcher dispatcher = new PostCommitHookDispatcher(List.of(
                new RecordingHook("first", new IllegalStateException("boom"), null, calls),
                new RecordingHook("second", null, "stok kurang", calls)));

        // When
        List<String> warnings = dispatcher.dispatch(PAID);

        // Then
        assertEquals(List.of("first", "second"), calls);
        assertEquals(2, warnings.size());
        assertTrue(warnings.get(0).startsWith("first 실패"));
        assertEquals("stok kurang", warnings.get(1));
    }

    @Test
    @DisplayName("이벤트 타입이 맞지 않는 훅은 실행하지 않음")
    void testDispatch_TypeFilter() {
        // Given
        List<String> calls = new ArrayList<>();
        PostCommitHookDispatcher dispatcher = new PostCommitHookDispatcher(List.of(
                new RecordingHook("paid", null, null, calls)));

        // When
        List<String> warnings = dispatcher.dispatch(new OrderServedEvent(1L, List.of()));

        // Then
        assertTrue(calls.isEmpty());
        assertTrue(warnings.isEmpty());
    }
}
