package com.coparent.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UpdateChildRequest {
    @Size(min = 1, max = 100)
    private String name;

    private LocalDate birthDate;

    @Size(max = 500)
    private String photoUrl;
}
