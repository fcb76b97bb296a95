package com.coparent.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class JoinFamilyRequest {
    @NotBlank
    @Pattern(regexp = "^\\d{6}$", message = "must be a 6 digit code")
    private String shareCode;
}
