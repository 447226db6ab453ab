package com.benefits.validation;

public enum Severity {
    CRITICAL,
    ERROR,
    WARNING
}
