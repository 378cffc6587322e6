package com.factory.palletizer.controller;

import com.factory.palletizer.config.PalletizerProperties;
import com.factory.palletizer.dto.PalletDetail;
import com.factory.palletizer.exception.PalletNotFoundException;
import com.factory.palletizer.model.Pallet;
import com.factory.palletizer.service.HistoryService;
import com.factory.palletizer.service.PalletLabelService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/pallets")
public class PalletController {

    private final HistoryService historyService;
    private final PalletLabelService labelService;
    private final PalletizerProperties properties;

    public PalletController(HistoryService historyService, PalletLabelService labelService,
            PalletizerProperties properties) {
        this.historyService = historyService;
        this.labelService = labelService;
        this.properties = properties;
    }

    @GetMapping("/{palletId}")
    public PalletDetail detail(@PathVariable String palletId) {
        Pallet pallet = historyService.findPallet(palletId)
                .orElseThrow(() -> new PalletNotFoundException(palletId));
        return new PalletDetail(pallet, historyService.palletDrums(palletId));
    }

    @GetMapping(value = "/{palletId}/label.png", produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> label(@PathVariable String palletId,
            @RequestParam(required = false) Integer size) {
        Pallet pallet = historyService.findPallet(palletId)
                .orElseThrow(() -> new PalletNotFoundException(palletId));
        int edge = size != null && size > 0 ? size : properties.getLabelSize();
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .body(labelService.renderLabel(pallet.getPalletId(), edge));
    }
}
