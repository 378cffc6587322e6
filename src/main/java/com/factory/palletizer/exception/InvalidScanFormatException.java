package com.factory.palletizer.exception;

public class InvalidScanFormatException extends PackingException {

    private final String rawScan;

    public InvalidScanFormatException(String rawScan) {
        super("INVALID_SCAN_FORMAT",
                "Cannot read drum type and drum number from scan '" + (rawScan == null ? "" : rawScan.trim())
                        + "'. Expected '<DRUM_TYPE> <DRUM_NUMBER>'.");
        this.rawScan = rawScan;
    }

    public String getRawScan() {
        return rawScan;
    }
}
