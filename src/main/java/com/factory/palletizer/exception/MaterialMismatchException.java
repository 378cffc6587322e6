package com.factory.palletizer.exception;

public class MaterialMismatchException extends PackingException {

    private final String expectedMaterialCode;
    private final String labelMaterialCode;

    public MaterialMismatchException(String expectedMaterialCode, String labelMaterialCode) {
        super("MATERIAL_MISMATCH", "Wrong material on label ('" + (labelMaterialCode == null ? "" : labelMaterialCode)
                + "'). Cannot register on the pallet for \"" + expectedMaterialCode + "\".");
        this.expectedMaterialCode = expectedMaterialCode;
        this.labelMaterialCode = labelMaterialCode;
    }

    public String getExpectedMaterialCode() {
        return expectedMaterialCode;
    }

    public String getLabelMaterialCode() {
        return labelMaterialCode;
    }
}
