package br.com.may.features.billing.application.gateway;

/**
 * Raw card data, accepted only by {@link PaymentGateway#tokenizeCard(CardData)}.
 */
public record CardData(String number, String holderName, int expMonth, int expYear, String cvv) {

    public String lastFour() {
        if (number == null || number.length() < 4) {
            return null;
        }
        return number.substring(number.length() - 4);
    }

    @Override
    public String toString() {
        return "CardData[lastFour=" + lastFour() + ", expMonth=" + expMonth + ", expYear=" + expYear + "]";
    }
}
