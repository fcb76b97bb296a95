package com.coparent.dto;

import com.coparent.entity.SwapRequest;
import jakarta.validation.constraints.NotNull;
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
public class CreateSwapRequest {
    @NotNull
    private LocalDate originalDate;

    /**
     * Required for {@code swap}, ignored for {@code one-way}.
     */
    private LocalDate proposedDate;

    @Builder.Default
    private SwapRequest.RequestType requestType = SwapRequest.RequestType.SWAP;

    @Size(max = 500)
    private String reason;
}
