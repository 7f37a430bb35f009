package com.questrail.transition.example;

import com.questrail.transition.api.StateChange;

public record LedgerChange(String account, long amount) implements StateChange {}
