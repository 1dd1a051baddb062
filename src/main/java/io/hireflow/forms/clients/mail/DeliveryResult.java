package io.hireflow.forms.clients.mail;

public record DeliveryResult(boolean success, String error) {

    public static DeliveryResult delivered() {
        return new DeliveryResult(true, null);
    }

    public static DeliveryResult failed(final String error) {
        return new DeliveryResult(false, error == null || error.isBlank() ? "Email delivery failed" : error);
    }
}
