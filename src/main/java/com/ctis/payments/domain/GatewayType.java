package com.ctis.payments.domain;

/**
 * Payment rails a transaction can be routed through. The set is closed: every value
 * has exactly one {@link com.ctis.payments.provider.ProviderAdapter} registered for it
 * and one row in {@link com.ctis.payments.provider.ProviderStatusCodes}.
 */
public enum GatewayType {
    /** Orange Money mobile wallet (push prompt + status polling). */
    ORANGE_MONEY,
    /** Africell Money mobile wallet (push prompt + status polling). */
    AFRICELL_MONEY,
    /** National payment switch reporting ISO 20022 pain.002 transaction status codes. */
    SALONE_SWITCH,
    /** Card / bank gateway that only reports outcomes through webhooks. */
    GENERIC_GATEWAY
}
