package com.flagship.finance_automation.pot;

public class PotNotFoundException extends RuntimeException {

    public PotNotFoundException(String name) {
        super("Pot not configured: " + name);
    }
}
