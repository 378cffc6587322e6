package com.factory.palletizer.repository;

import com.factory.palletizer.model.AppSetting;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AppSettingRepository extends JpaRepository<AppSetting, Long> {
    Optional<AppSetting> findBySettingKey(String settingKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from AppSetting s where s.settingKey = :settingKey")
    Optional<AppSetting> findBySettingKeyForUpdate(@Param("settingKey") String settingKey);
}
