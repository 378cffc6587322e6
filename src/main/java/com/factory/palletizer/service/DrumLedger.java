package com.factory.palletizer.service;

import com.factory.palletizer.dto.ScanEntry;
import com.factory.palletizer.exception.ActiveSetChangedException;
import com.factory.palletizer.exception.DuplicateDrumException;
import com.factory.palletizer.exception.MaterialMismatchException;
import com.factory.palletizer.exception.MaterialNotFoundException;
import com.factory.palletizer.exception.MissingQuantityException;
import com.factory.palletizer.model.Drum;
import com.factory.palletizer.model.DrumStatus;
import com.factory.palletizer.model.Material;
import com.factory.palletizer.model.Pallet;
import com.factory.palletizer.repository.DrumRepository;
import com.factory.palletizer.repository.MaterialRepository;
import com.factory.palletizer.repository.PalletRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps the drums scanned onto each open pallet. Mutations of one material are
 * serialized by a row lock on the material, so the active set seen inside a
 * mutation is the authoritative one.
 */
@Service
public class DrumLedger {

    private static final Logger logger = LoggerFactory.getLogger(DrumLedger.class);

    private final MaterialRepository materialRepository;
    private final DrumRepository drumRepository;
    private final PalletRepository palletRepository;
    private final AuditService auditService;

    public DrumLedger(MaterialRepository materialRepository, DrumRepository drumRepository,
            PalletRepository palletRepository, AuditService auditService) {
        this.materialRepository = materialRepository;
        this.drumRepository = drumRepository;
        this.palletRepository = palletRepository;
        this.auditService = auditService;
    }

    @Transactional(readOnly = true)
    public List<Drum> listActive(String materialCode) {
        return drumRepository.findByMaterialCodeAndStatusOrderByCreatedAtAscIdAsc(materialCode, DrumStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public Optional<Drum> find(String drumNumber) {
        return drumRepository.findByDrumNumber(drumNumber);
    }

    @Transactional(readOnly = true)
    public Map<String, Long> activeCounts() {
        return drumRepository.countByStatusGrouped(DrumStatus.ACTIVE).stream()
                .collect(Collectors.toMap(obj -> (String) obj[0], obj -> (Long) obj[1]));
    }

    @Transactional
    public Drum append(ScanEntry entry) {
        String drumNumber = entry.label().drumNumber();
        String materialCode = normalize(entry.materialCode());
        Material material = materialRepository.findByMaterialCodeForUpdate(materialCode)
                .orElseThrow(() -> new MaterialNotFoundException(materialCode));

        // 1. One record per drum number, whatever its status
        Optional<Drum> prior = drumRepository.findByDrumNumber(drumNumber);
        if (prior.isPresent()) {
            DuplicateDrumException duplicate = duplicateOf(prior.get());
            logger.warn("Rejected scan of drum {} for material {}: {}", drumNumber, material.getMaterialCode(),
                    duplicate.getMessage());
            throw duplicate;
        }

        // 2. Label must belong to the pallet being packed
        String labelMaterial = entry.labelMaterialCode() == null ? "" : entry.labelMaterialCode().trim();
        if (!material.getMaterialCode().equals(labelMaterial)) {
            logger.warn("Rejected scan of drum {}: label material '{}' on pallet of {}", drumNumber, labelMaterial,
                    material.getMaterialCode());
            throw new MaterialMismatchException(material.getMaterialCode(), labelMaterial);
        }

        // 3. Quantity
        String standardQty = entry.standardQty() == null ? "" : entry.standardQty().trim();
        if (standardQty.isEmpty() && !material.isAllowIncomplete()) {
            throw new MissingQuantityException(drumNumber);
        }

        Drum drum = new Drum();
        drum.setDrumNumber(drumNumber);
        drum.setDrumType(entry.label().drumType());
        drum.setMaterialCode(material.getMaterialCode());
        drum.setStandardQty(standardQty);
        drum.setStatus(DrumStatus.ACTIVE);
        drum.setPalletId("");
        drum.setCreatedAt(LocalDateTime.now());
        drum.setOperatorName(entry.operator());
        drum.setDeviceId(entry.deviceId());

        Drum saved;
        try {
            saved = drumRepository.saveAndFlush(drum);
        } catch (DataIntegrityViolationException e) {
            // Same number inserted by another session for a different material
            logger.warn("Drum {} was registered concurrently: {}", drumNumber, e.getMostSpecificCause().getMessage());
            throw DuplicateDrumException.concurrent(drumNumber);
        }

        logger.info("Drum {} ({}) added to material {} by {}", drumNumber, saved.getDrumType(),
                material.getMaterialCode(), entry.operator());
        return saved;
    }

    @Transactional
    public Optional<Drum> undoLast(String materialCode) {
        return undoLast(materialCode, null);
    }

    /**
     * Deletes the most recently scanned active drum of the material. When
     * {@code expectedDrumNumber} is given, the drum is only deleted if it is
     * still the last one, so a repeated request cannot remove a second drum.
     */
    @Transactional
    public Optional<Drum> undoLast(String selectedMaterialCode, String expectedDrumNumber) {
        String materialCode = normalize(selectedMaterialCode);
        materialRepository.findByMaterialCodeForUpdate(materialCode);

        Optional<Drum> last = drumRepository.findFirstByMaterialCodeAndStatusOrderByCreatedAtDescIdDesc(materialCode,
                DrumStatus.ACTIVE);
        if (last.isEmpty()) {
            logger.info("Undo requested for material {} but no active drums", materialCode);
            return Optional.empty();
        }

        Drum drum = last.get();
        if (expectedDrumNumber != null && !expectedDrumNumber.isBlank()
                && !expectedDrumNumber.trim().equals(drum.getDrumNumber())) {
            throw new ActiveSetChangedException(materialCode,
                    "last drum is " + drum.getDrumNumber() + ", not " + expectedDrumNumber.trim());
        }

        drumRepository.delete(drum);
        drumRepository.flush();

        logger.info("Drum {} removed from open pallet of material {}", drum.getDrumNumber(), materialCode);
        auditService.log("UNDO_DRUM", "Material: " + materialCode + ", Drum: " + drum.getDrumNumber());
        return Optional.of(drum);
    }

    // Same normalization as MaterialCatalog.get
    private static String normalize(String materialCode) {
        return materialCode == null ? "" : materialCode.trim();
    }

    private DuplicateDrumException duplicateOf(Drum prior) {
        String palletId = prior.getPalletId() == null ? "" : prior.getPalletId();
        if (palletId.isBlank()) {
            return new DuplicateDrumException(prior.getDrumNumber(), prior.getMaterialCode(), "", null);
        }
        LocalDateTime palletDate = palletRepository.findByPalletId(palletId)
                .map(Pallet::getCreatedAt)
                .orElse(null);
        return new DuplicateDrumException(prior.getDrumNumber(), prior.getMaterialCode(), palletId, palletDate);
    }
}
