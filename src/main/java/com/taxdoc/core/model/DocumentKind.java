package com.taxdoc.core.model;

public enum DocumentKind {
    RETURN,
    ATTACHMENT,
    RECEIPT_NOTICE,
    PAYMENT_NOTICE,
    LEDGER,
    SCHEDULE,
    SUMMARY_TABLE,
    UNCLASSIFIED
}
