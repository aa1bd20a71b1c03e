package com.queryengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
@AllArgsConstructor
public class DateRange {

    LocalDate start;
    LocalDate end;
}
