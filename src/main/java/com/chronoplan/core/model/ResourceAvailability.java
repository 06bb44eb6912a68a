package com.chronoplan.core.model;

import java.time.YearMonth;

/**
 * Capacity left on a resource for one month. {@link #available()} goes negative when
 * the month is over-allocated.
 */
public record ResourceAvailability(YearMonth month, int capacity, int allocated) {

    public int available() {
        return capacity - allocated;
    }
}
