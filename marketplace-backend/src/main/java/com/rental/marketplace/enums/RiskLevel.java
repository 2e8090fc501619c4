package com.rental.marketplace.enums;

public enum RiskLevel {
    MINIMAL,
    LOW,
    MEDIUM,
    HIGH
}
