package com.coparent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "user_settings")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserSettings {

    @Id
    @Column(length = 128)
    private String userId;

    @Builder.Default
    @Column(length = 5)
    private String language = "en";

    @Builder.Default
    @Column(length = 64)
    private String timezone = "UTC";

    @Builder.Default
    @Column(length = 20)
    private String dateFormat = "MM/DD/YYYY";

    @Builder.Default
    @Column(length = 5)
    private String timeFormat = "12h";

    @Builder.Default
    @Column(length = 10)
    private String weekStart = "sunday";

    @Builder.Default
    @Column(length = 10)
    private String theme = "auto";

    @UpdateTimestamp
    private Instant updatedAt;
}
