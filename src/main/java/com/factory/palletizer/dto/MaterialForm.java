package com.factory.palletizer.dto;

import lombok.Data;

@Data
public class MaterialForm {
    private String materialCode;
    private String description;
    private Integer maxQty;
    private String prefix;
    private boolean allowIncomplete;
    private Boolean active; // null keeps the material active
}
