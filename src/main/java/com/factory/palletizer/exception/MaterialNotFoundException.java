package com.factory.palletizer.exception;

public class MaterialNotFoundException extends PackingException {

    public MaterialNotFoundException(String materialCode) {
        super("MATERIAL_NOT_FOUND", "Material not found: " + materialCode);
    }
}
