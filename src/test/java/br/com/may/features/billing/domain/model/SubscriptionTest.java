package br.com.may.features.billing.domain.model;

import br.com.may.features.billing.domain.exception.IllegalSubscriptionTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);
    private static final UUID USER_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    private static Subscription active(LocalDateTime periodEnd) {
        Subscription subscription = Subscription.pending(USER_ID, "pro", BillingCycle.MONTHLY, new BigDecimal("97.00"));
        subscription.transitionTo(SubscriptionStatus.ACTIVE, NOW.minusMonths(1));
        subscription.applyPaidPeriod(NOW.minusMonths(1), periodEnd, periodEnd);
        return subscription;
    }

    @Nested
    @DisplayName("transitionTo")
    class TransitionTo {

        @Test
        @DisplayName("rejects a move outside the table")
        void rejectsIllegalMove() {
            Subscription subscription = Subscription.pending(USER_ID, "pro", BillingCycle.MONTHLY, BigDecimal.TEN);

            assertThatThrownBy(() -> subscription.transitionTo(SubscriptionStatus.PAST_DUE, NOW))
                    .isInstanceOf(IllegalSubscriptionTransitionException.class);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PENDING);
        }

        @Test
        @DisplayName("stamps canceledAt on cancel and clears it on reactivation")
        void cancelAndReactivate() {
            Subscription subscription = active(NOW.plusDays(10));

            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);
            assertThat(subscription.getCanceledAt()).isEqualTo(NOW);

            subscription.transitionTo(SubscriptionStatus.ACTIVE, NOW.plusDays(1));
            assertThat(subscription.getCanceledAt()).isNull();
        }
    }

    @Nested
    @DisplayName("applyPaidPeriod")
    class ApplyPaidPeriod {

        @Test
        @DisplayName("extends the period end")
        void extendsPeriod() {
            Subscription subscription = active(NOW.plusDays(5));

            subscription.applyPaidPeriod(NOW.plusDays(5), NOW.plusDays(35), NOW.plusDays(35));

            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(NOW.plusDays(35));
            assertThat(subscription.getNextBillingAt()).isEqualTo(NOW.plusDays(35));
        }

        @Test
        @DisplayName("never moves the period end backwards")
        void neverShortens() {
            Subscription subscription = active(NOW.plusDays(30));

            subscription.applyPaidPeriod(NOW, NOW.plusDays(10), NOW.plusDays(10));

            assertThat(subscription.getCurrentPeriodEnd()).isEqualTo(NOW.plusDays(30));
        }
    }

    @Nested
    @DisplayName("access")
    class Access {

        @Test
        @DisplayName("canceled keeps access until the paid period ends")
        void canceledKeepsAccess() {
            Subscription subscription = active(NOW.plusDays(3));
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);

            assertThat(subscription.grantsAccess(NOW)).isTrue();
            assertThat(subscription.grantsAccess(NOW.plusDays(3))).isFalse();
        }

        @Test
        @DisplayName("past due keeps access until the paid period ends")
        void pastDueKeepsAccess() {
            Subscription subscription = active(NOW.plusDays(3));
            subscription.transitionTo(SubscriptionStatus.PAST_DUE, NOW);

            assertThat(subscription.grantsAccess(NOW.plusDays(2))).isTrue();
            assertThat(subscription.grantsAccess(NOW.plusDays(4))).isFalse();
        }

        @Test
        @DisplayName("trial grants access until it ends")
        void trialAccess() {
            Subscription subscription = Subscription.trial(USER_ID, NOW, NOW.plusDays(7));

            assertThat(subscription.getPlanCode()).isEqualTo("trial");
            assertThat(subscription.getTrialEndsAt()).isEqualTo(NOW.plusDays(7));
            assertThat(subscription.grantsAccess(NOW.plusDays(6))).isTrue();
            assertThat(subscription.grantsAccess(NOW.plusDays(7))).isFalse();
        }

        @Test
        @DisplayName("pending never grants access")
        void pendingNoAccess() {
            Subscription subscription = Subscription.pending(USER_ID, "pro", BillingCycle.MONTHLY, BigDecimal.TEN);

            assertThat(subscription.grantsAccess(NOW)).isFalse();
        }
    }

    @Nested
    @DisplayName("new lifecycle on a reused row")
    class NewLifecycle {

        @Test
        @DisplayName("a canceled row whose period ended can start over")
        void closedRowStartsOver() {
            Subscription subscription = active(NOW.minusDays(1));
            subscription.setProviderSubscriptionId("sub_old");
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW.minusDays(2));

            subscription.beginNewLifecycle(SubscriptionStatus.PENDING);

            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PENDING);
            assertThat(subscription.getProviderSubscriptionId()).isNull();
            assertThat(subscription.getCurrentPeriodEnd()).isNull();
            assertThat(subscription.getCanceledAt()).isNull();
        }

        @Test
        @DisplayName("a canceled row still inside its period starts over without its old period")
        void canceledInsidePeriodStartsOver() {
            Subscription subscription = active(NOW.plusDays(10));
            subscription.setProviderOrderId("or_old");
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);

            subscription.beginNewLifecycle(SubscriptionStatus.PENDING);

            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PENDING);
            assertThat(subscription.getProviderOrderId()).isNull();
            assertThat(subscription.getCurrentPeriodEnd()).isNull();
        }

        @Test
        @DisplayName("a past-due row keeps its lifecycle")
        void pastDueCannotStartOver() {
            Subscription subscription = active(NOW.plusDays(10));
            subscription.transitionTo(SubscriptionStatus.PAST_DUE, NOW);

            assertThatThrownBy(() -> subscription.beginNewLifecycle(SubscriptionStatus.PENDING))
                    .isInstanceOf(IllegalSubscriptionTransitionException.class);
            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
        }

        @Test
        @DisplayName("a new lifecycle cannot start active")
        void cannotStartActive() {
            Subscription subscription = Subscription.pending(USER_ID, "pro", BillingCycle.MONTHLY, BigDecimal.TEN);

            assertThatThrownBy(() -> subscription.beginNewLifecycle(SubscriptionStatus.ACTIVE))
                    .isInstanceOf(IllegalSubscriptionTransitionException.class);
        }

        @Test
        @DisplayName("an active row cannot begin a trial")
        void activeCannotBeginTrial() {
            Subscription subscription = active(NOW.plusDays(10));

            assertThatThrownBy(() -> subscription.beginTrial(NOW, NOW.plusDays(7)))
                    .isInstanceOf(IllegalSubscriptionTransitionException.class);
        }

        @Test
        @DisplayName("a pending row can begin a trial")
        void pendingBeginsTrial() {
            Subscription subscription = Subscription.pending(USER_ID, "pro", BillingCycle.ANNUAL, BigDecimal.TEN);

            subscription.beginTrial(NOW, NOW.plusDays(7));

            assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.TRIAL);
            assertThat(subscription.getBillingCycle()).isEqualTo(BillingCycle.MONTHLY);
            assertThat(subscription.getAmount()).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("resuming a canceled row")
    class Resumable {

        @Test
        @DisplayName("a locally canceled row inside its paid period can resume")
        void insidePeriod() {
            Subscription subscription = active(NOW.plusDays(10));
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);

            assertThat(subscription.isResumable(NOW)).isTrue();
        }

        @Test
        @DisplayName("a row whose paid period ended cannot resume")
        void periodEnded() {
            Subscription subscription = active(NOW.minusDays(40));
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW.minusDays(45));

            assertThat(subscription.isResumable(NOW)).isFalse();
        }

        @Test
        @DisplayName("a row canceled at the provider cannot resume")
        void canceledAtProvider() {
            Subscription subscription = active(NOW.plusDays(10));
            subscription.setProviderSubscriptionId("sub_1");
            subscription.transitionTo(SubscriptionStatus.CANCELED, NOW);

            assertThat(subscription.isResumable(NOW)).isFalse();
        }

        @Test
        @DisplayName("only canceled rows resume")
        void onlyCanceled() {
            assertThat(active(NOW.plusDays(10)).isResumable(NOW)).isFalse();
        }
    }
}
