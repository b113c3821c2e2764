package com.keer.seating.event.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventRequest {

    @NotBlank
    private String name;

    @NotNull
    private LocalDate eventDate;

    @NotBlank
    @Email
    private String organizerEmail;
}
