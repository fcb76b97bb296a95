package com.coparent.dto;

import com.coparent.entity.SwapRequest;
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
public class SwapStatusRequest {
    /**
     * One of approved, rejected or cancelled.
     */
    @NotNull
    private SwapRequest.Status status;

    @Size(max = 500)
    private String responseNote;
}
