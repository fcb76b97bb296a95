package com.coparent.dto;

import com.coparent.entity.CustodyOverride;
import com.coparent.entity.ParentSlot;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CreateCustodyOverrideRequest {
    @Size(max = 200)
    private String name;

    @NotNull
    private CustodyOverride.Type type;

    @NotNull
    private Instant startDate;

    @NotNull
    private Instant endDate;

    @NotEmpty
    private Map<LocalDate, ParentSlot> assignments;

    @Size(max = 500)
    private String note;

    private Boolean requestApproval;
}
