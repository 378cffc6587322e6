package com.factory.palletizer.dto;

/**
 * One drum scan as confirmed by the operator.
 *
 * @param materialCode          material of the pallet being packed
 * @param labelMaterialCode     material code read or typed from the drum label
 * @param label                 parsed drum type and number
 * @param standardQty           quantity printed on the label, free-form
 * @param operator              authenticated operator name
 * @param deviceId              scanning station
 */
public record ScanEntry(
        String materialCode,
        String labelMaterialCode,
        ScannedLabel label,
        String standardQty,
        String operator,
        String deviceId) {
}
