package com.coparent.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Local mirror of an identity-provider account. The id is the provider's subject.
 */
@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @Column(length = 128)
    private String id;

    @Column(nullable = false)
    private String email;

    @Column
    private String fullName;

    @Column
    private String photoUrl;

    @Column(length = 20)
    private String calendarColor;

    @Column
    private Long activeFamilyId;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public String getDisplayName() {
        if (fullName != null && !fullName.isBlank()) {
            return fullName;
        }
        return email;
    }
}
