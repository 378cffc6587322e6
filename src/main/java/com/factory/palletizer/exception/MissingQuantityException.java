package com.factory.palletizer.exception;

public class MissingQuantityException extends PackingException {

    public MissingQuantityException(String drumNumber) {
        super("MISSING_QUANTITY", "Standard quantity is required for drum " + drumNumber + ".");
    }
}
