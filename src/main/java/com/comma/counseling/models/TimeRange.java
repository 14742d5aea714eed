package com.comma.counseling.models;

import lombok.Value;

import java.time.LocalTime;

@Value
public class TimeRange {
    LocalTime start;
    LocalTime end;
}
