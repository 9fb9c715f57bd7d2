package io.weaver.core.validation;

public enum Severity {
    ERROR,
    WARNING
}
