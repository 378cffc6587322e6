package com.factory.palletizer.model;

public enum CompleteType {
    FULL,
    INCOMPLETE
}
