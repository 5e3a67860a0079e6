package com.pricecheck.checker.ratelimit;

/** Independent admission budgets; each client has its own counters per class. */
public enum RateLimitClass {
    GLOBAL,
    CHECK,
    HEAVY,
    ADMIN
}
