package com.factory.palletizer.dto;

import com.factory.palletizer.model.Drum;
import com.factory.palletizer.model.Pallet;

import java.util.List;

public record PalletDetail(
        Pallet pallet,
        List<Drum> drums) {
}
