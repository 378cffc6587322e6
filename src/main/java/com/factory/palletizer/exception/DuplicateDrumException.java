package com.factory.palletizer.exception;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Raised when a drum number already has a record. An empty prior pallet id
 * means the drum is still waiting on an open pallet; otherwise the drum was
 * sealed before and the operator must check the label physically.
 */
public class DuplicateDrumException extends PackingException {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String drumNumber;
    private final String priorMaterialCode;
    private final String priorPalletId;
    private final LocalDateTime priorCreatedAt;

    public DuplicateDrumException(String drumNumber, String priorMaterialCode, String priorPalletId,
            LocalDateTime priorCreatedAt) {
        super("DUPLICATE_DRUM", buildMessage(drumNumber, priorMaterialCode, priorPalletId, priorCreatedAt));
        this.drumNumber = drumNumber;
        this.priorMaterialCode = priorMaterialCode;
        this.priorPalletId = priorPalletId == null ? "" : priorPalletId;
        this.priorCreatedAt = priorCreatedAt;
    }

    // Lost a race against another session inserting the same number
    public static DuplicateDrumException concurrent(String drumNumber) {
        return new DuplicateDrumException(drumNumber, null, "", null);
    }

    private static String buildMessage(String drumNumber, String materialCode, String palletId,
            LocalDateTime createdAt) {
        if (palletId == null || palletId.isBlank()) {
            String where = materialCode == null || materialCode.isBlank()
                    ? "an open pallet"
                    : "the open pallet of material " + materialCode;
            return "Drum " + drumNumber + " is already scanned on " + where + ". Please check!";
        }
        String date = createdAt == null ? "N/A" : createdAt.format(DATE_FORMAT);
        return "Drum " + drumNumber + " already exists on pallet " + palletId + " from " + date
                + ". Please check!";
    }

    public String getDrumNumber() {
        return drumNumber;
    }

    public String getPriorMaterialCode() {
        return priorMaterialCode;
    }

    public String getPriorPalletId() {
        return priorPalletId;
    }

    public LocalDateTime getPriorCreatedAt() {
        return priorCreatedAt;
    }

    public boolean isHistorical() {
        return !priorPalletId.isBlank();
    }
}
