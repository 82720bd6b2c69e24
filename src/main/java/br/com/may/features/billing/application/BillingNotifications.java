package br.com.may.features.billing.application;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * In-app notification titles and messages shown to customers. Titles double as the
 * deduplication key of {@code NotificationService.notifyOnce}.
 */
public final class BillingNotifications {

    public static final String PAYMENT_CONFIRMED = "Pagamento Confirmado";
    public static final String PAYMENT_DECLINED = "Pagamento Recusado";
    public static final String PAYMENT_INTEGRATION_FAILURE = "Falha na Integração de Pagamento";
    public static final String RECURRING_PAYMENT_FAILED = "Falha no Pagamento Recorrente";
    public static final String PAYMENT_PROCESSING = "Pagamento em Processamento";
    public static final String SUBSCRIPTION_ACTIVATED = "Assinatura Ativada!";
    public static final String WELCOME = "Bem-vindo à MAY!";
    public static final String SUBSCRIPTION_REACTIVATED = "Assinatura Reativada!";
    public static final String SUBSCRIPTION_CANCELED = "Assinatura Cancelada";

    private static final Locale PT_BR = Locale.forLanguageTag("pt-BR");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy", PT_BR);

    private BillingNotifications() {
    }

    public static String paymentConfirmed(BigDecimal amount, LocalDateTime activeUntil) {
        return "Seu pagamento de " + brl(amount) + " foi confirmado. Sua assinatura está ativa até "
                + DATE.format(activeUntil) + ".";
    }

    public static String paymentDeclined(String reason) {
        return "Seu pagamento foi recusado. Motivo: " + reason + ". Por favor, atualize seu método de pagamento.";
    }

    /**
     * Does not mention the card: the failure is on our side.
     */
    public static String integrationFailure() {
        return "Não foi possível processar seu pagamento no momento por um problema técnico. "
                + "Nenhuma cobrança foi feita. Por favor, tente novamente mais tarde.";
    }

    public static String recurringPaymentFailed(String reason) {
        return "A cobrança recorrente da sua assinatura falhou: " + reason
                + ". Atualize seu método de pagamento para continuar usando a MAY.";
    }

    public static String paymentProcessing(String planName) {
        return "Seu pagamento do plano " + planName + " está sendo processado. Você receberá uma confirmação em breve.";
    }

    public static String subscriptionActivated(String planName) {
        return "Seu plano " + planName + " foi ativado com sucesso. Aproveite todos os recursos!";
    }

    public static String welcomeTrial(int trialDays) {
        return "Seu trial de " + trialDays + " dias começou. Aproveite todas as funcionalidades!";
    }

    public static String subscriptionReactivated(String planName) {
        return "Sua assinatura " + planName + " foi reativada. Aproveite todas as funcionalidades!";
    }

    public static String subscriptionCanceled(LocalDateTime accessUntil) {
        if (accessUntil == null) {
            return "Sua assinatura foi cancelada.";
        }
        return "Sua assinatura foi cancelada. Você ainda terá acesso até " + DATE.format(accessUntil) + ".";
    }

    public static String brl(BigDecimal amount) {
        return String.format(PT_BR, "R$ %,.2f", amount);
    }
}
