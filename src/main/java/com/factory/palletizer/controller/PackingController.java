package com.factory.palletizer.controller;

import com.factory.palletizer.config.PalletizerProperties;
import com.factory.palletizer.dto.GeneratePalletRequest;
import com.factory.palletizer.dto.MaterialOverview;
import com.factory.palletizer.dto.ScanEntry;
import com.factory.palletizer.dto.ScanRequest;
import com.factory.palletizer.dto.ScannedLabel;
import com.factory.palletizer.model.Drum;
import com.factory.palletizer.model.Material;
import com.factory.palletizer.model.Pallet;
import com.factory.palletizer.service.DrumLedger;
import com.factory.palletizer.service.MaterialCatalog;
import com.factory.palletizer.service.PalletAssembler;
import com.factory.palletizer.service.ScanParser;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Operator workflow: pick a material, scan drums, undo, seal the pallet.
 */
@RestController
@RequestMapping("/api/materials")
public class PackingController {

    private final MaterialCatalog materialCatalog;
    private final DrumLedger drumLedger;
    private final PalletAssembler palletAssembler;
    private final ScanParser scanParser;
    private final PalletizerProperties properties;

    public PackingController(MaterialCatalog materialCatalog, DrumLedger drumLedger, PalletAssembler palletAssembler,
            ScanParser scanParser, PalletizerProperties properties) {
        this.materialCatalog = materialCatalog;
        this.drumLedger = drumLedger;
        this.palletAssembler = palletAssembler;
        this.scanParser = scanParser;
        this.properties = properties;
    }

    @GetMapping
    public List<MaterialOverview> overview() {
        Map<String, Long> counts = drumLedger.activeCounts();
        return materialCatalog.listActive().stream()
                .map(m -> MaterialOverview.of(m, counts.getOrDefault(m.getMaterialCode(), 0L)))
                .collect(Collectors.toList());
    }

    @GetMapping("/{materialCode}")
    public MaterialOverview material(@PathVariable String materialCode) {
        Material material = materialCatalog.require(materialCode);
        return MaterialOverview.of(material, drumLedger.listActive(material.getMaterialCode()).size());
    }

    @GetMapping("/{materialCode}/drums")
    public List<Drum> activeDrums(@PathVariable String materialCode) {
        return drumLedger.listActive(materialCatalog.require(materialCode).getMaterialCode());
    }

    @PostMapping("/{materialCode}/drums")
    public ResponseEntity<Drum> scan(@PathVariable String materialCode, @RequestBody ScanRequest request,
            @RequestHeader(value = "X-Device-Id", required = false) String deviceId,
            Authentication authentication) {
        ScannedLabel label = scanParser.parse(request.getScan());
        ScanEntry entry = new ScanEntry(
                materialCode,
                request.getMaterialCode(),
                label,
                request.getStandardQty(),
                authentication.getName(),
                deviceId == null || deviceId.isBlank() ? properties.getDeviceId() : deviceId);
        Drum drum = drumLedger.append(entry);
        return ResponseEntity.status(HttpStatus.CREATED).body(drum);
    }

    @DeleteMapping("/{materialCode}/drums/last")
    public ResponseEntity<Drum> undoLast(@PathVariable String materialCode,
            @RequestParam(required = false) String expected) {
        return drumLedger.undoLast(materialCode, expected)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{materialCode}/pallets")
    public ResponseEntity<Pallet> generatePallet(@PathVariable String materialCode,
            @RequestBody(required = false) GeneratePalletRequest request) {
        GeneratePalletRequest command = request != null ? request : new GeneratePalletRequest();
        Material material = materialCatalog.require(materialCode);
        List<Drum> activeDrums = drumLedger.listActive(material.getMaterialCode());
        Pallet pallet = palletAssembler.assemble(material, command.getCompleteType(), activeDrums);
        return ResponseEntity.status(HttpStatus.CREATED).body(pallet);
    }
}
