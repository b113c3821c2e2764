package com.keer.seating.seating.given;

import com.keer.seating.ScenarioContext;
import com.keer.seating.auth.AdminTokenVerifier;
import com.keer.seating.seating.dto.ImportCommand;
import com.keer.seating.seating.dto.ImportMode;
import com.keer.seating.seating.dto.ImportRow;
import com.keer.seating.seating.service.SeatingEngine;
import io.cucumber.datatable.DataTable;
import io.cucumber.java.zh_tw.假如;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Map;

/**
 * 直接透過 SeatingEngine 準備座位資料，不經過 HTTP
 */
public class SeatingGivenSteps {

    @Autowired
    private SeatingEngine seatingEngine;

    @Autowired
    private AdminTokenVerifier adminTokenVerifier;

    @Autowired
    private ScenarioContext scenarioContext;

    @假如("婚宴中已匯入以下賓客:")
    public void 婚宴中已匯入以下賓客(DataTable dataTable) {
        List<ImportRow> rows = dataTable.asMaps(String.class, String.class).stream()
                .map(SeatingGivenSteps::toRow)
                .toList();

        seatingEngine.importSeating(adminTokenVerifier.verify(ScenarioContext.ADMIN_AUTHORIZATION),
                scenarioContext.getEventId(),
                ImportCommand.builder().mode(ImportMode.UPSERT).rows(rows).build());
    }

    static ImportRow toRow(Map<String, String> row) {
        return ImportRow.builder()
                .guestName(row.get("guestName"))
                .tableLabel(row.get("tableLabel"))
                .dietaryNotes(row.get("dietaryNotes"))
                .contact(row.get("contact"))
                .build();
    }
}
