package com.flagship.payments_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Point-in-time summary of one client account.
 *
 * Note: available, held and total can all be negative after a disputed withdrawal.
 */
@Value
public class AccountSnapshot {
    int clientId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;
}
