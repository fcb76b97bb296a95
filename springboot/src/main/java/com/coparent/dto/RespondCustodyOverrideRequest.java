package com.coparent.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RespondCustodyOverrideRequest {
    @NotNull
    private Boolean approve;

    @Size(max = 500)
    private String responseNote;
}
