package com.flagship.bookkeeping.ledger;

/**
 * Cash-flow statement section a cash movement belongs to.
 */
public enum FlowCategory {
    OPERATING,
    INVESTING,
    FINANCING
}
