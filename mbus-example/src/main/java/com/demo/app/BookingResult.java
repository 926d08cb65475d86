package com.demo.app;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingResult {
    public static final String EVENT_TYPE = "bookings.result.v1";

    private String bookingId;
    private String status;
}
