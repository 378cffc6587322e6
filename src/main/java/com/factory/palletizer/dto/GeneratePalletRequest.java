package com.factory.palletizer.dto;

import com.factory.palletizer.model.CompleteType;
import lombok.Data;

@Data
public class GeneratePalletRequest {
    private CompleteType completeType = CompleteType.FULL;
}
