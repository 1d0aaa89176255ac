package com.cronium.channel;

/**
 * Outcome of one notification attempt.
 */
public record DeliveryResult(boolean success, String error) {

    public static DeliveryResult ok() {
        return new DeliveryResult(true, null);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, error);
    }
}
