package com.sensorplatform.common.health;

/**
 * Rank of a health rule. Declaration order is rank order: the first constant
 * is the most severe.
 */
public enum Severity {
    CRITICAL,
    WARNING
}
