package com.factory.palletizer.exception;

public class ActiveSetChangedException extends PackingException {

    public ActiveSetChangedException(String materialCode, String detail) {
        super("ACTIVE_SET_CHANGED",
                "Drums on the open pallet of material " + materialCode + " changed meanwhile: " + detail
                        + ". Reload and try again.");
    }
}
