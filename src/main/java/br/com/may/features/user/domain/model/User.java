package br.com.may.features.user.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Account owned by the account subsystem. Billing reads it and writes only the gateway
 * customer references and the trial flags.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "users")
public class User {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "name")
    private String name;

    /** Pagar.me customer reference ({@code cus_...}). */
    @Column(name = "provider_customer_id")
    private String providerCustomerId;

    /** Stripe customer reference ({@code cus_...}). */
    @Column(name = "stripe_customer_id")
    private String stripeCustomerId;

    /** CPF (11 digits) or CNPJ (14 digits), digits only. */
    @Column(name = "tax_document", length = 14)
    private String taxDocument;

    @Column(name = "phone", length = 20)
    private String phone;

    @Column(name = "has_used_trial", nullable = false)
    private boolean trialUsed;

    @Column(name = "trial_started_at")
    private LocalDateTime trialStartedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt = LocalDateTime.now();
}
