package com.lifebutler.assistant.model;

import lombok.Value;

import java.time.LocalDate;

@Value
public class TrendPoint {

    /** First day of the bucket. */
    LocalDate period;

    double value;

    int count;
}
