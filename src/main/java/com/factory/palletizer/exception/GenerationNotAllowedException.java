package com.factory.palletizer.exception;

import com.factory.palletizer.model.CompleteType;

public class GenerationNotAllowedException extends PackingException {

    public GenerationNotAllowedException(String materialCode, CompleteType completeType, int drumCount, int maxQty) {
        super("GENERATION_NOT_ALLOWED", "Cannot generate a " + completeType + " pallet for material " + materialCode
                + " with " + drumCount + " drum(s) (max qty " + maxQty + ").");
    }

    public GenerationNotAllowedException(String materialCode, CompleteType completeType, String reason) {
        super("GENERATION_NOT_ALLOWED",
                "Cannot generate a " + completeType + " pallet for material " + materialCode + ": " + reason);
    }
}
