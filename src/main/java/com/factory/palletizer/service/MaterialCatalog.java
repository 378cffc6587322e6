package com.factory.palletizer.service;

import com.factory.palletizer.exception.MaterialNotFoundException;
import com.factory.palletizer.model.Material;
import com.factory.palletizer.repository.MaterialRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the material master data. Writes go through {@link AdminService}.
 */
@Service
@Transactional(readOnly = true)
public class MaterialCatalog {

    private final MaterialRepository materialRepository;

    public MaterialCatalog(MaterialRepository materialRepository) {
        this.materialRepository = materialRepository;
    }

    public Optional<Material> get(String materialCode) {
        if (materialCode == null || materialCode.isBlank()) {
            return Optional.empty();
        }
        return materialRepository.findByMaterialCode(materialCode.trim());
    }

    public Material require(String materialCode) {
        return get(materialCode).orElseThrow(() -> new MaterialNotFoundException(materialCode));
    }

    public List<Material> listActive() {
        return materialRepository.findByActiveTrueOrderByMaterialCodeAsc();
    }

    public List<Material> listAll() {
        return materialRepository.findAllByOrderByMaterialCodeAsc();
    }
}
