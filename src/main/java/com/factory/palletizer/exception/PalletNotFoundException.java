package com.factory.palletizer.exception;

public class PalletNotFoundException extends PackingException {

    public PalletNotFoundException(String palletId) {
        super("PALLET_NOT_FOUND", "Pallet not found: " + palletId);
    }
}
