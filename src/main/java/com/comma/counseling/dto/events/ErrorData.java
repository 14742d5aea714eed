package com.comma.counseling.dto.events;

import lombok.Value;

@Value
public class ErrorData {
    String message;
}
