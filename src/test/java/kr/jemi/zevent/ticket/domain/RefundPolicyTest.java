package kr.jemi.zevent.ticket.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static kr.jemi.zevent.ticket.domain.TicketFixtures.*;
import static org.assertj.core.api.Assertions.*;

class RefundPolicyTest {

    private final RefundPolicy policy = new RefundPolicy(true, 14, 50);

    @Nested
    @DisplayName("evaluate()")
    class Evaluate {

        @Test
        @DisplayName("이벤트 20일 전 35.00 티켓은 50%인 17.50을 환불받는다")
        void eligibleWithHalfRefund() {
            RefundDecision decision = policy.evaluate(paidStripe(1L), NOW, NOW.plusDays(20));

            assertThat(decision.eligible()).isTrue();
            assertThat(decision.amount()).isEqualByComparingTo("17.50");
        }

        @Test
        @DisplayName("정확히 14일 전은 환불 대상이다")
        void exactNoticeIsEligible() {
            RefundDecision decision = policy.evaluate(paidStripe(1L), NOW, NOW.plusDays(14));

            assertThat(decision.eligible()).isTrue();
        }

        @Test
        @DisplayName("남은 일수는 내림한다: 13일 23시간은 13일이다")
        void partialDaysAreTruncated() {
            RefundDecision decision = policy.evaluate(paidStripe(1L), NOW, NOW.plusDays(14).minusHours(1));

            assertThat(decision.eligible()).isFalse();
            assertThat(decision.amount()).isEqualByComparingTo("0.00");
        }

        @Test
        @DisplayName("paid가 아닌 티켓은 환불 대상이 아니다")
        void onlyPaidTickets() {
            RefundDecision decision = policy.evaluate(pendingStripe(1L), NOW, NOW.plusDays(30));

            assertThat(decision.eligible()).isFalse();
        }

        @Test
        @DisplayName("환불 정책이 꺼져 있으면 항상 대상이 아니다")
        void disabledPolicy() {
            RefundDecision decision = RefundPolicy.disabled().evaluate(paidStripe(1L), NOW, NOW.plusDays(100));

            assertThat(decision.eligible()).isFalse();
        }
    }

    @Test
    @DisplayName("부분 환불 금액은 센트 단위 반올림(HALF_UP)")
    void partialAmountRounding() {
        RefundPolicy third = new RefundPolicy(true, 0, 33);

        assertThat(third.partialAmount(new BigDecimal("45.00"))).isEqualByComparingTo("14.85");
        assertThat(policy.partialAmount(new BigDecimal("0.05"))).isEqualByComparingTo("0.03");
    }

    @Test
    @DisplayName("비율은 0~100 사이여야 한다")
    void invalidPercent() {
        assertThatThrownBy(() -> new RefundPolicy(true, 14, 101))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
