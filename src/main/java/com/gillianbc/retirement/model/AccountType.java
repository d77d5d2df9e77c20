package com.gillianbc.retirement.model;

/**
 * Investment account kinds and the tax category their balance counts towards.
 */
public enum AccountType {
    TRADITIONAL_401K(TaxCategory.TAX_DEFERRED),
    IRA(TaxCategory.TAX_DEFERRED),
    ROTH_IRA(TaxCategory.TAX_FREE),
    BROKERAGE(TaxCategory.TAXABLE),
    CASH(TaxCategory.TAXABLE),
    OTHER(TaxCategory.TAXABLE);

    private final TaxCategory taxCategory;

    AccountType(TaxCategory taxCategory) {
        this.taxCategory = taxCategory;
    }

    public TaxCategory getTaxCategory() {
        return taxCategory;
    }
}
