package com.factory.palletizer.repository;

import com.factory.palletizer.model.Drum;
import com.factory.palletizer.model.DrumStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface DrumRepository extends JpaRepository<Drum, Long> {
    Optional<Drum> findByDrumNumber(String drumNumber);

    List<Drum> findByMaterialCodeAndStatusOrderByCreatedAtAscIdAsc(String materialCode, DrumStatus status);

    Optional<Drum> findFirstByMaterialCodeAndStatusOrderByCreatedAtDescIdDesc(String materialCode, DrumStatus status);

    List<Drum> findByPalletIdOrderByCreatedAtAscIdAsc(String palletId);

    List<Drum> findByCreatedAtBetweenOrderByCreatedAtDesc(LocalDateTime from, LocalDateTime to);

    List<Drum> findAllByOrderByCreatedAtDesc();

    @Query("SELECT d.materialCode, COUNT(d) FROM Drum d WHERE d.status = :status GROUP BY d.materialCode")
    List<Object[]> countByStatusGrouped(@Param("status") DrumStatus status);
}
