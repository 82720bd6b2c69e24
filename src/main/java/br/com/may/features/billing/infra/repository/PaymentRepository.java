package br.com.may.features.billing.infra.repository;

import br.com.may.features.billing.domain.model.Payment;
import br.com.may.features.billing.domain.model.PaymentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    Optional<Payment> findByProviderTransactionId(String providerTransactionId);

    Optional<Payment> findByProviderInvoiceId(String providerInvoiceId);

    List<Payment> findBySubscriptionIdOrderByCreatedAtDesc(UUID subscriptionId, Pageable pageable);

    boolean existsBySubscriptionIdAndStatus(UUID subscriptionId, PaymentStatus status);

    long countByProviderTransactionId(String providerTransactionId);
}
