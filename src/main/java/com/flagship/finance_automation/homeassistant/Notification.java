package com.flagship.finance_automation.homeassistant;

import lombok.Value;

/**
 * A message for a human, delivered through the notify script.
 */
@Value
public class Notification {
    String title;
    String message;
}
