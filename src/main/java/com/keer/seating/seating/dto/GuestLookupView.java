package com.keer.seating.seating.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * What a guest sees in the portal: their own record, their table and who else sits there.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GuestLookupView(long eventId,
                              String eventName,
                              GuestView guest,
                              TableView table,
                              List<String> tablemates,
                              long sequence) {
}
