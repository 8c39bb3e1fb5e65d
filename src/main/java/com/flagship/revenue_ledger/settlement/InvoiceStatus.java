package com.flagship.revenue_ledger.settlement;

/**
 * Lifecycle of a settlement invoice.
 *
 * DRAFT -> SENT -> PAID, or SENT -> DISPUTED. Repeating the transition that produced
 * the current status is a no-op; every other move is rejected.
 */
public enum InvoiceStatus {
    /**
     * Generated by the settlement aggregator, not yet delivered to the client.
     */
    DRAFT,

    /**
     * Delivered to the client. Can become PAID or DISPUTED.
     */
    SENT,

    /**
     * Terminal.
     */
    PAID,

    /**
     * Client contested the invoice. Terminal for this engine; resolution happens outside it.
     */
    DISPUTED
}
