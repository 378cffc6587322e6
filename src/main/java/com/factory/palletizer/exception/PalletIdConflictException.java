package com.factory.palletizer.exception;

public class PalletIdConflictException extends PackingException {

    public PalletIdConflictException(String palletId) {
        super("PALLET_ID_CONFLICT", "Pallet " + palletId
                + " already exists. Advance the global pallet counter before generating again.");
    }
}
