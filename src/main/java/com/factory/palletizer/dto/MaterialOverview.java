package com.factory.palletizer.dto;

import com.factory.palletizer.model.CompleteType;
import com.factory.palletizer.model.Material;
import com.factory.palletizer.service.PalletAssembler;

/**
 * Material tile shown on the operator start screen.
 */
public record MaterialOverview(
        String materialCode,
        String description,
        int maxQty,
        String prefix,
        boolean allowIncomplete,
        long activeCount,
        FillState fillState,
        boolean fullAllowed,
        boolean incompleteAllowed) {

    public enum FillState {
        EMPTY,
        IN_PROGRESS,
        FULL
    }

    public static MaterialOverview of(Material material, long activeCount) {
        int maxQty = material.getMaxQty() == null ? 0 : material.getMaxQty();
        FillState state;
        if (activeCount == 0) {
            state = FillState.EMPTY;
        } else if (activeCount < maxQty) {
            state = FillState.IN_PROGRESS;
        } else {
            state = FillState.FULL;
        }
        int count = (int) activeCount;
        return new MaterialOverview(
                material.getMaterialCode(),
                material.getDescription(),
                maxQty,
                material.getPrefix(),
                material.isAllowIncomplete(),
                activeCount,
                state,
                PalletAssembler.isGenerationAllowed(material, CompleteType.FULL, count),
                PalletAssembler.isGenerationAllowed(material, CompleteType.INCOMPLETE, count));
    }
}
