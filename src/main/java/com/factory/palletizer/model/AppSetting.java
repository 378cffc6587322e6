package com.factory.palletizer.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

/**
 * Keyed system value. The global pallet counter lives here as a decimal
 * string under {@code global_pallet_counter}.
 */
@Entity
@Table(name = "app_settings")
@Data
public class AppSetting {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, updatable = false)
    private String settingKey;

    @Column(nullable = false, length = 64)
    private String settingValue;

    private LocalDateTime updatedAt;

    // Incremented by every counter allocation
    @Version
    private Long version;

    public AppSetting() {
    }

    public AppSetting(String settingKey, long value) {
        this.settingKey = settingKey;
        this.settingValue = Long.toString(value);
    }

    /**
     * @throws IllegalStateException if the stored value is not a whole number
     */
    public long longValue() {
        if (settingValue == null || settingValue.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(settingValue.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Setting " + settingKey + " is not a number: '" + settingValue + "'", e);
        }
    }

    public void assign(long value) {
        this.settingValue = Long.toString(value);
    }

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = LocalDateTime.now();
    }
}
