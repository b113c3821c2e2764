package com.keer.seating.seating.dto;

import java.util.List;

/**
 * Export in the same shape the import accepts, so it can be re-imported as is.
 */
public record SeatingExport(long eventId,
                            String eventName,
                            long sequence,
                            List<TableSpec> tables,
                            List<ImportRow> rows) {
}
