package com.autobudget.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ActionKind {
    SET_BUDGET("set_budget"),
    INCREASE_BUDGET("increase_budget"),
    PAUSE("pause"),
    RESUME("resume");

    private final String storeValue;

    /** True for kinds that carry a new daily budget. */
    public boolean changesBudget() {
        return this == SET_BUDGET || this == INCREASE_BUDGET;
    }
}
