package com.coparent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "custody_approvals")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustodyApproval {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private CustodySchedule.Pattern pattern;

    @Column(nullable = false)
    private Instant startDate;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "custody_approval_parent1_days", joinColumns = @JoinColumn(name = "approval_id"))
    @OrderColumn(name = "position")
    @Column(name = "day_of_week")
    private List<Integer> parent1Days = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "custody_approval_parent2_days", joinColumns = @JoinColumn(name = "approval_id"))
    @OrderColumn(name = "position")
    @Column(name = "day_of_week")
    private List<Integer> parent2Days = new ArrayList<>();

    @Column(nullable = false, length = 128)
    private String requestedById;

    @Column
    private String requestedByName;

    @Column(nullable = false)
    private Instant requestedAt;
}
