package com.factory.palletizer.repository;

import com.factory.palletizer.model.Material;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface MaterialRepository extends JpaRepository<Material, Long> {
    Optional<Material> findByMaterialCode(String materialCode);

    List<Material> findByActiveTrueOrderByMaterialCodeAsc();

    List<Material> findAllByOrderByMaterialCodeAsc();

    // Serializes every ledger mutation and pallet assembly of one material
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from Material m where m.materialCode = :materialCode")
    Optional<Material> findByMaterialCodeForUpdate(@Param("materialCode") String materialCode);
}
