package com.acme.autodoist.core;

/**
 * One inbound webhook attempt exactly as received.
 */
public record WebhookDelivery(String deliveryId, String signature, byte[] body) {}
