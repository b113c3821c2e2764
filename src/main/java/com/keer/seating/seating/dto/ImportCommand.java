package com.keer.seating.seating.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportCommand {

    private ImportMode mode;

    @Builder.Default
    private List<ImportRow> rows = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<TableSpec> tables = new ArrayList<>();

    @Builder.Default
    private List<String> removeTables = new ArrayList<>();

    private Boolean createMissingTables;

    public ImportMode effectiveMode() {
        return mode != null ? mode : ImportMode.UPSERT;
    }

    public boolean createsMissingTables() {
        return createMissingTables == null || createMissingTables;
    }
}
