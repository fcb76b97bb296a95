package com.coparent.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UpdateProfileRequest {
    @Size(min = 1, max = 100)
    private String fullName;

    @Size(max = 500)
    private String photoUrl;

    @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "must be a hex colour like #8b5cf6")
    private String calendarColor;
}
