package com.factory.palletizer.repository;

import com.factory.palletizer.model.Pallet;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface PalletRepository extends JpaRepository<Pallet, Long> {
    Optional<Pallet> findByPalletId(String palletId);

    boolean existsByPalletId(String palletId);

    List<Pallet> findByCreatedAtBetweenOrderByCreatedAtDesc(LocalDateTime from, LocalDateTime to);

    List<Pallet> findAllByOrderByCreatedAtDesc();
}
