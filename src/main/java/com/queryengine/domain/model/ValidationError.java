package com.queryengine.domain.model;

import lombok.Value;

@Value
public class ValidationError {

    String field;
    String reason;
}
