package com.factory.palletizer.service;

import com.factory.palletizer.model.Drum;
import com.factory.palletizer.model.Pallet;
import com.factory.palletizer.repository.DrumRepository;
import com.factory.palletizer.repository.PalletRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class HistoryService {

    private final PalletRepository palletRepository;
    private final DrumRepository drumRepository;

    public HistoryService(PalletRepository palletRepository, DrumRepository drumRepository) {
        this.palletRepository = palletRepository;
        this.drumRepository = drumRepository;
    }

    public Optional<Pallet> findPallet(String palletId) {
        return palletRepository.findByPalletId(palletId);
    }

    public List<Drum> palletDrums(String palletId) {
        return drumRepository.findByPalletIdOrderByCreatedAtAscIdAsc(palletId);
    }

    public Optional<Drum> findDrum(String drumNumber) {
        return drumRepository.findByDrumNumber(drumNumber.trim());
    }

    public List<Pallet> pallets(HistoryPeriod period, LocalDate from, LocalDate to, String materialFilter) {
        LocalDate today = LocalDate.now();
        LocalDateTime start = period.start(today, from, to);
        LocalDateTime end = period.end(today, from, to);
        List<Pallet> pallets = start == null
                ? palletRepository.findAllByOrderByCreatedAtDesc()
                : palletRepository.findByCreatedAtBetweenOrderByCreatedAtDesc(start, end);
        return filterByMaterial(pallets, Pallet::getMaterialCode, materialFilter);
    }

    public List<Drum> drums(HistoryPeriod period, LocalDate from, LocalDate to, String materialFilter) {
        LocalDate today = LocalDate.now();
        LocalDateTime start = period.start(today, from, to);
        LocalDateTime end = period.end(today, from, to);
        List<Drum> drums = start == null
                ? drumRepository.findAllByOrderByCreatedAtDesc()
                : drumRepository.findByCreatedAtBetweenOrderByCreatedAtDesc(start, end);
        return filterByMaterial(drums, Drum::getMaterialCode, materialFilter);
    }

    private static <T> List<T> filterByMaterial(List<T> rows, Function<T, String> materialCode, String filter) {
        if (filter == null || filter.isBlank()) {
            return rows;
        }
        String needle = filter.trim().toLowerCase(Locale.ROOT);
        return rows.stream()
                .filter(row -> {
                    String code = materialCode.apply(row);
                    return code != null && code.toLowerCase(Locale.ROOT).contains(needle);
                })
                .collect(Collectors.toList());
    }
}
