package com.coparent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(name = "family_invites",
        uniqueConstraints = @UniqueConstraint(columnNames = {"family_id", "email"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FamilyInvite {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "family_id", nullable = false)
    private Family family;

    @Column(nullable = false)
    private String email; // normalised, lower-case

    @Column
    private String displayEmail;

    @Column(nullable = false, length = 128)
    private String invitedById;

    @Column
    private String invitedByName;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status = Status.PENDING;

    @CreationTimestamp
    private Instant createdAt;

    public enum Status {
        PENDING, ACCEPTED, DECLINED
    }
}
