package com.demo.app;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCommand {
    public static final String EVENT_TYPE = "bookings.command.v1";

    private String action;
    private Map<String, Object> params;
}
