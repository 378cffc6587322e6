package com.factory.palletizer.model;

public enum DrumStatus {
    ACTIVE,
    COMPLETED
}
