package com.factory.palletizer.service;

import com.factory.palletizer.dto.MaterialForm;
import com.factory.palletizer.model.Material;
import com.factory.palletizer.repository.MaterialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AdminService {

    private static final Logger logger = LoggerFactory.getLogger(AdminService.class);

    private final MaterialRepository materialRepository;
    private final CounterAllocator counterAllocator;
    private final AuditService auditService;

    public AdminService(MaterialRepository materialRepository, CounterAllocator counterAllocator,
            AuditService auditService) {
        this.materialRepository = materialRepository;
        this.counterAllocator = counterAllocator;
        this.auditService = auditService;
    }

    @Transactional
    public Material saveMaterial(MaterialForm form) {
        String code = form.getMaterialCode() == null ? "" : form.getMaterialCode().trim();
        if (code.isEmpty()) {
            throw new IllegalArgumentException("Material code is required.");
        }
        if (form.getMaxQty() == null || form.getMaxQty() < 1) {
            throw new IllegalArgumentException("Max qty / pallet must be at least 1.");
        }

        Material material = materialRepository.findByMaterialCode(code).orElseGet(Material::new);
        boolean created = material.getId() == null;
        material.setMaterialCode(code);
        material.setDescription(form.getDescription() == null ? "" : form.getDescription().trim());
        material.setMaxQty(form.getMaxQty());
        material.setPrefix(form.getPrefix() == null ? "" : form.getPrefix().trim());
        material.setAllowIncomplete(form.isAllowIncomplete());
        material.setActive(form.getActive() == null || form.getActive());
        Material saved = materialRepository.save(material);

        logger.info("Material {} {}", code, created ? "created" : "updated");
        auditService.log(created ? "CREATE_MATERIAL" : "UPDATE_MATERIAL",
                "Material: " + code + ", Max qty: " + saved.getMaxQty() + ", Prefix: " + saved.getPrefix()
                        + ", Allow incomplete: " + saved.isAllowIncomplete() + ", Active: " + saved.isActive());
        return saved;
    }

    @Transactional
    public void setCounter(long value) {
        long previous = counterAllocator.set(value);
        auditService.log("SET_COUNTER", "Global pallet counter: " + previous + " -> " + value);
    }
}
