package com.coparent.dto;

import com.coparent.entity.FamilyChild;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ChildResponse {
    private Long id;
    private String name;
    private LocalDate birthDate;
    private String photoUrl;

    public static ChildResponse from(FamilyChild child) {
        return ChildResponse.builder()
                .id(child.getId())
                .name(child.getName())
                .birthDate(child.getBirthDate())
                .photoUrl(child.getPhotoUrl())
                .build();
    }
}
