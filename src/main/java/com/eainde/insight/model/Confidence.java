package com.eainde.insight.model;

public enum Confidence {
    LOW,
    MEDIUM,
    HIGH
}
