package br.com.may.features.billing.infra.repository;

import br.com.may.features.billing.domain.model.BillingCycle;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.Subscription;
import br.com.may.features.billing.domain.model.SubscriptionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findByUserId(UUID userId);

    Optional<Subscription> findByProviderSubscriptionId(String providerSubscriptionId);

    Optional<Subscription> findByProviderOrderId(String providerOrderId);

    /**
     * Active subscriptions whose next charge is due and that this system rebills itself.
     */
    @Query("""
            select s from Subscription s
            where s.status = :status
              and s.provider = :provider
              and s.nextBillingAt <= :now
              and s.billingCycle in :cycles
              and s.canceledAt is null
            order by s.nextBillingAt asc
            """)
    List<Subscription> findDueForRecurringCharge(@Param("status") SubscriptionStatus status,
                                                 @Param("provider") GatewayProvider provider,
                                                 @Param("cycles") Collection<BillingCycle> cycles,
                                                 @Param("now") LocalDateTime now);

    /**
     * Rows are reused across checkouts, so the age of a pending checkout is its last update.
     */
    List<Subscription> findByStatusAndUpdatedAtBefore(SubscriptionStatus status, LocalDateTime updatedBefore);
}
