package com.z254.lighthouse.beacon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Inclusive calendar range.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Period {

    private LocalDate start;

    private LocalDate end;

    public static Period of(LocalDate start, LocalDate end) {
        return new Period(start, end);
    }
}
