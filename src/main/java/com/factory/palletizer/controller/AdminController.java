package com.factory.palletizer.controller;

import com.factory.palletizer.dto.CounterUpdate;
import com.factory.palletizer.dto.MaterialForm;
import com.factory.palletizer.model.AuditLog;
import com.factory.palletizer.model.Drum;
import com.factory.palletizer.model.Material;
import com.factory.palletizer.model.Pallet;
import com.factory.palletizer.service.AdminService;
import com.factory.palletizer.service.AuditService;
import com.factory.palletizer.service.CounterAllocator;
import com.factory.palletizer.service.HistoryPeriod;
import com.factory.palletizer.service.HistoryService;
import com.factory.palletizer.service.MaterialCatalog;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private final AdminService adminService;
    private final CounterAllocator counterAllocator;
    private final MaterialCatalog materialCatalog;
    private final HistoryService historyService;
    private final AuditService auditService;

    public AdminController(AdminService adminService, CounterAllocator counterAllocator,
            MaterialCatalog materialCatalog, HistoryService historyService, AuditService auditService) {
        this.adminService = adminService;
        this.counterAllocator = counterAllocator;
        this.materialCatalog = materialCatalog;
        this.historyService = historyService;
        this.auditService = auditService;
    }

    @GetMapping("/settings")
    public Map<String, Object> settings() {
        return Map.of(CounterAllocator.KEY_GLOBAL_PALLET_COUNTER, counterAllocator.current());
    }

    @PutMapping("/settings/counter")
    public Map<String, Object> setCounter(@RequestBody CounterUpdate update) {
        if (update.getValue() == null) {
            throw new IllegalArgumentException("Counter value is required.");
        }
        adminService.setCounter(update.getValue());
        return settings();
    }

    @GetMapping("/materials")
    public List<Material> materials() {
        return materialCatalog.listAll();
    }

    @PutMapping("/materials/{materialCode}")
    public Material saveMaterial(@PathVariable String materialCode, @RequestBody MaterialForm form) {
        form.setMaterialCode(materialCode);
        return adminService.saveMaterial(form);
    }

    @GetMapping("/pallets")
    public List<Pallet> pallets(@RequestParam(defaultValue = "ALL") HistoryPeriod period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) String material) {
        return historyService.pallets(period, from, to, material);
    }

    @GetMapping("/drums")
    public List<Drum> drums(@RequestParam(defaultValue = "ALL") HistoryPeriod period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) String material) {
        return historyService.drums(period, from, to, material);
    }

    @GetMapping("/drums/{drumNumber}")
    public ResponseEntity<Drum> drum(@PathVariable String drumNumber) {
        return historyService.findDrum(drumNumber)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/audit")
    public List<AuditLog> audit() {
        return auditService.recent();
    }
}
