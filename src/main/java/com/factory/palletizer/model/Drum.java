package com.factory.palletizer.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "drums")
@Data
public class Drum {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String drumNumber; // Printed serial, unique across all pallets

    private String drumType;

    @Column(nullable = false)
    private String materialCode;

    // Captured as typed on the label, not validated numerically
    private String standardQty;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DrumStatus status;

    @Column(nullable = false)
    private String palletId = "";

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private String operatorName;

    private String deviceId;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = LocalDateTime.now();
        if (status == null)
            status = DrumStatus.ACTIVE;
        if (palletId == null)
            palletId = "";
    }
}
