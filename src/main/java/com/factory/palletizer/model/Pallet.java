package com.factory.palletizer.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

@Entity
@Table(name = "pallets")
@Immutable
@Data
public class Pallet {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, updatable = false)
    private String palletId; // prefix + global counter, e.g. SL-595912

    @Column(nullable = false, updatable = false)
    private String materialCode;

    // Material description at the time the pallet was sealed
    @Column(updatable = false)
    private String description;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "drum_count", nullable = false, updatable = false)
    private Integer count;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private CompleteType completeType;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
