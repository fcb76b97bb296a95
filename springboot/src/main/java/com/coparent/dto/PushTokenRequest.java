package com.coparent.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PushTokenRequest {
    @NotBlank
    @Size(max = 512)
    private String token;

    @Size(max = 20)
    private String platform;
}
