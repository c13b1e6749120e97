package com.planlens.core.model;

public enum RiskCategory {
    TECHNICAL,
    RESOURCE,
    SCHEDULE,
    SCOPE,
    EXTERNAL
}
