package com.flagship.finance_automation.homeassistant;

import lombok.Value;

import java.util.Map;

/**
 * A raw state entity value with attributes, e.g. {@code var.truelayer_balance_amex_cards = "123.45"}.
 */
@Value
public class StateUpdate {
    String entityId;
    String value;
    Map<String, Object> attributes;
}
