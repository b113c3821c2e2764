package com.keer.seating.event.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keer.seating.ScenarioContext;
import com.keer.seating.event.dto.EventRequest;
import io.cucumber.java.zh_tw.當;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDate;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;

public class EventWhenSteps {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ScenarioContext scenarioContext;

    @當("^我以管理員身分建立一個婚宴，名稱為「(.+)」，日期為「(.+)」，聯絡信箱為「(.+)」$")
    public void 我以管理員身分建立一個婚宴(String name, String eventDate, String email) throws Exception {
        EventRequest request = new EventRequest(name, LocalDate.parse(eventDate), email);

        MvcResult result = mockMvc.perform(
                post("/api/admin/events")
                        .header(HttpHeaders.AUTHORIZATION, ScenarioContext.ADMIN_AUTHORIZATION)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andReturn();

        scenarioContext.setLastResponse(result);
    }

    @當("我以管理員身分查詢該婚宴")
    public void 我以管理員身分查詢該婚宴() throws Exception {
        MvcResult result = mockMvc.perform(
                get("/api/admin/events/{id}", scenarioContext.getEventId())
                        .header(HttpHeaders.AUTHORIZATION, ScenarioContext.ADMIN_AUTHORIZATION))
                .andReturn();

        scenarioContext.setLastResponse(result);
    }

    @當("我未帶管理員憑證查詢該婚宴")
    public void 我未帶管理員憑證查詢該婚宴() throws Exception {
        MvcResult result = mockMvc.perform(
                get("/api/admin/events/{id}", scenarioContext.getEventId()))
                .andReturn();

        scenarioContext.setLastResponse(result);
    }

    @當("^我以錯誤的管理員憑證「(.+)」查詢該婚宴$")
    public void 我以錯誤的管理員憑證查詢該婚宴(String token) throws Exception {
        MvcResult result = mockMvc.perform(
                get("/api/admin/events/{id}", scenarioContext.getEventId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andReturn();

        scenarioContext.setLastResponse(result);
    }

    @當("我以管理員身分刪除該婚宴")
    public void 我以管理員身分刪除該婚宴() throws Exception {
        MvcResult result = mockMvc.perform(
                delete("/api/admin/events/{id}", scenarioContext.getEventId())
                        .header(HttpHeaders.AUTHORIZATION, ScenarioContext.ADMIN_AUTHORIZATION))
                .andReturn();

        scenarioContext.setLastResponse(result);
    }

    @當("^我查詢該婚宴的公開座位概覽(，包含賓客姓名)?$")
    public void 我查詢該婚宴的公開座位概覽(String withNames) throws Exception {
        MvcResult result = mockMvc.perform(
                get("/api/public/events/{publicCode}/summary", scenarioContext.get("publicCode"))
                        .param("includeNames", String.valueOf(withNames != null)))
                .andReturn();

        scenarioContext.setLastResponse(result);
    }
}
