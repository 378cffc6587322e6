package com.factory.palletizer.service;

import com.factory.palletizer.exception.ActiveSetChangedException;
import com.factory.palletizer.exception.GenerationNotAllowedException;
import com.factory.palletizer.exception.MaterialNotFoundException;
import com.factory.palletizer.exception.PalletIdConflictException;
import com.factory.palletizer.model.CompleteType;
import com.factory.palletizer.model.Drum;
import com.factory.palletizer.model.DrumStatus;
import com.factory.palletizer.model.Material;
import com.factory.palletizer.model.Pallet;
import com.factory.palletizer.repository.DrumRepository;
import com.factory.palletizer.repository.MaterialRepository;
import com.factory.palletizer.repository.PalletRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Seals the open pallet of a material: allocates the pallet id, completes the
 * drums and records the pallet in a single transaction.
 */
@Service
public class PalletAssembler {

    private static final Logger logger = LoggerFactory.getLogger(PalletAssembler.class);

    private final MaterialRepository materialRepository;
    private final DrumRepository drumRepository;
    private final PalletRepository palletRepository;
    private final CounterAllocator counterAllocator;
    private final AuditService auditService;

    public PalletAssembler(MaterialRepository materialRepository, DrumRepository drumRepository,
            PalletRepository palletRepository, CounterAllocator counterAllocator, AuditService auditService) {
        this.materialRepository = materialRepository;
        this.drumRepository = drumRepository;
        this.palletRepository = palletRepository;
        this.counterAllocator = counterAllocator;
        this.auditService = auditService;
    }

    /**
     * FULL needs at least max qty drums; INCOMPLETE needs the material to allow it
     * and a count strictly between zero and max qty.
     */
    public static boolean isGenerationAllowed(Material material, CompleteType completeType, int drumCount) {
        int maxQty = material.getMaxQty() == null ? 0 : material.getMaxQty();
        switch (completeType) {
            case FULL:
                return maxQty > 0 && drumCount >= maxQty;
            case INCOMPLETE:
                return material.isAllowIncomplete() && drumCount > 0 && drumCount < maxQty;
            default:
                return false;
        }
    }

    /**
     * @param material     material selected by the operator
     * @param completeType FULL or INCOMPLETE
     * @param activeDrums  the open pallet as the operator saw it
     */
    @Transactional
    public Pallet assemble(Material material, CompleteType completeType, List<Drum> activeDrums) {
        String materialCode = material.getMaterialCode();
        checkAllowed(material, completeType, activeDrums.size());

        // Re-check against the locked row; the caller's copy may be stale
        Material current = materialRepository.findByMaterialCodeForUpdate(materialCode)
                .orElseThrow(() -> new MaterialNotFoundException(materialCode));
        checkAllowed(current, completeType, activeDrums.size());

        List<Drum> drums = drumRepository.findByMaterialCodeAndStatusOrderByCreatedAtAscIdAsc(materialCode,
                DrumStatus.ACTIVE);
        verifySnapshot(materialCode, activeDrums, drums);

        long counter = counterAllocator.next();
        String prefix = current.getPrefix() == null ? "" : current.getPrefix();
        String palletId = prefix + counter;
        if (palletRepository.existsByPalletId(palletId)) {
            logger.warn("Pallet id {} already taken; counter was probably rewound", palletId);
            throw new PalletIdConflictException(palletId);
        }

        for (Drum drum : drums) {
            drum.setStatus(DrumStatus.COMPLETED);
            drum.setPalletId(palletId);
        }
        drumRepository.saveAll(drums);

        Pallet pallet = new Pallet();
        pallet.setPalletId(palletId);
        pallet.setMaterialCode(materialCode);
        pallet.setDescription(current.getDescription() == null ? "" : current.getDescription());
        pallet.setCreatedAt(LocalDateTime.now());
        pallet.setCount(drums.size());
        pallet.setCompleteType(completeType);
        Pallet saved = palletRepository.saveAndFlush(pallet);

        logger.info("Pallet {} generated for material {} ({} drums, {})", palletId, materialCode, drums.size(),
                completeType);
        auditService.log("GENERATE_PALLET", "Pallet: " + palletId + ", Material: " + materialCode + ", Drums: "
                + drums.size() + ", Type: " + completeType);
        return saved;
    }

    private void checkAllowed(Material material, CompleteType completeType, int drumCount) {
        if (completeType == null) {
            throw new IllegalArgumentException("Complete type is required");
        }
        if (!isGenerationAllowed(material, completeType, drumCount)) {
            int maxQty = material.getMaxQty() == null ? 0 : material.getMaxQty();
            logger.warn("Rejected {} pallet for material {}: {} drum(s), max qty {}, allow incomplete {}",
                    completeType, material.getMaterialCode(), drumCount, maxQty, material.isAllowIncomplete());
            if (completeType == CompleteType.INCOMPLETE && !material.isAllowIncomplete()) {
                throw new GenerationNotAllowedException(material.getMaterialCode(), completeType,
                        "material does not allow incomplete pallets");
            }
            throw new GenerationNotAllowedException(material.getMaterialCode(), completeType, drumCount, maxQty);
        }
    }

    private void verifySnapshot(String materialCode, List<Drum> snapshot, List<Drum> current) {
        Set<String> expected = snapshot.stream().map(Drum::getDrumNumber).collect(Collectors.toSet());
        Set<String> actual = current.stream().map(Drum::getDrumNumber).collect(Collectors.toSet());
        if (expected.size() != snapshot.size() || !expected.equals(actual)) {
            throw new ActiveSetChangedException(materialCode,
                    "expected " + snapshot.size() + " drum(s), found " + current.size());
        }
    }
}
