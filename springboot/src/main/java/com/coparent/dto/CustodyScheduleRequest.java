package com.coparent.dto;

import com.coparent.entity.CustodySchedule;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Day numbers run from 0 (Sunday) to 6 (Saturday).
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CustodyScheduleRequest {
    @Size(max = 100)
    private String name;

    @NotNull
    private CustodySchedule.Pattern pattern;

    @NotNull
    private Instant startDate;

    private Instant endDate;

    @Builder.Default
    private List<@NotNull @Min(0) @Max(6) Integer> parent1Days = new ArrayList<>();

    @Builder.Default
    private List<@NotNull @Min(0) @Max(6) Integer> parent2Days = new ArrayList<>();

    @Builder.Default
    private List<@NotNull @Min(0) @Max(6) Integer> biweeklyAltParent1Days = new ArrayList<>();

    @Builder.Default
    private List<@NotNull @Min(0) @Max(6) Integer> biweeklyAltParent2Days = new ArrayList<>();

    private Boolean isActive;

    /**
     * Stage the change for the other parent's consent instead of applying it.
     */
    private boolean requestApproval;
}
