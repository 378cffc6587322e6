package com.factory.palletizer.dto;

import lombok.Data;

@Data
public class ScanRequest {
    private String scan; // "DWP1500_LV 15518289"
    private String materialCode; // From the drum label
    private String standardQty;
}
