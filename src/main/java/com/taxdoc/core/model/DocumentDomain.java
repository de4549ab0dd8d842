package com.taxdoc.core.model;

/**
 * Tax domain a document type belongs to. Only the two local-tax domains take part in slot numbering.
 */
public enum DocumentDomain {
    NATIONAL_TAX,
    LOCAL_TAX_PREFECTURE,
    LOCAL_TAX_MUNICIPALITY,
    CONSUMPTION_TAX,
    ACCOUNTING,
    ASSETS,
    SUMMARY;

    public boolean isLocalTax() {
        return this == LOCAL_TAX_PREFECTURE || this == LOCAL_TAX_MUNICIPALITY;
    }
}
