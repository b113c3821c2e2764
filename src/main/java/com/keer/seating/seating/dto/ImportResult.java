package com.keer.seating.seating.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportResult {

    private Long eventId;

    private ImportMode mode;

    // committed sequence after the import; unchanged when the import was a no-op
    private long sequence;

    private int added;

    private int updated;

    private int unchanged;

    private int removedGuests;

    private int removedTables;

    private List<RowOutcome> rows;
}
