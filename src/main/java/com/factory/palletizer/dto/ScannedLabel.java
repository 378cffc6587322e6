package com.factory.palletizer.dto;

public record ScannedLabel(
        String drumType,
        String drumNumber) {
}
