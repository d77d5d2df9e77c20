package com.gillianbc.retirement.model;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class YearlySpending {
    int age;
    @NonNull BigDecimal amount;
    String phaseName;
}
