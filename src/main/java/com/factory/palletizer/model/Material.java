package com.factory.palletizer.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "materials")
@Data
public class Material {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String materialCode; // e.g. 60115949

    private String description;

    // Drums per full pallet
    @Column(nullable = false)
    private Integer maxQty = 0;

    // Pallet id prefix, e.g. SL-5959
    @Column(nullable = false)
    private String prefix = "";

    private boolean allowIncomplete = false;

    private boolean active = true;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (prefix == null) {
            prefix = "";
        }
    }

    public boolean isPackable() {
        return maxQty != null && maxQty > 0;
    }
}
