package com.gillianbc.retirement.model;

/**
 * Tax treatment of an investment account.
 */
public enum TaxCategory {
    /** Traditional 401k / IRA: withdrawals taxed as income, subject to RMDs. */
    TAX_DEFERRED,
    /** Roth-style accounts. */
    TAX_FREE,
    /** Brokerage and cash. */
    TAXABLE
}
