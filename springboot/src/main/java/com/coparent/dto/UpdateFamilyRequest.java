package com.coparent.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UpdateFamilyRequest {
    @Size(max = 100)
    private String name;

    @Size(max = 500)
    private String photoUrl;
}
