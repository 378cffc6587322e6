package com.factory.palletizer.service;

import com.factory.palletizer.dto.ScannedLabel;
import com.factory.palletizer.exception.InvalidScanFormatException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Splits the keystrokes of a drum label scan, e.g. {@code "DWP1500_LV 15518289"},
 * into drum type and drum number. The number is the last token; every token
 * before it belongs to the type.
 */
@Component
public class ScanParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public ScannedLabel parse(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidScanFormatException(raw);
        }

        String[] tokens = WHITESPACE.split(trimmed);
        if (tokens.length < 2) {
            throw new InvalidScanFormatException(raw);
        }

        String drumNumber = tokens[tokens.length - 1];
        String drumType = String.join(" ", Arrays.copyOf(tokens, tokens.length - 1));
        return new ScannedLabel(drumType, drumNumber);
    }
}
