package com.factory.palletizer.service;

import com.factory.palletizer.model.AppSetting;
import com.factory.palletizer.repository.AppSettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out the global pallet sequence stored in {@code app_settings}.
 */
@Service
public class CounterAllocator {

    public static final String KEY_GLOBAL_PALLET_COUNTER = "global_pallet_counter";

    private static final Logger logger = LoggerFactory.getLogger(CounterAllocator.class);

    private final AppSettingRepository settingRepository;

    public CounterAllocator(AppSettingRepository settingRepository) {
        this.settingRepository = settingRepository;
    }

    /**
     * Returns the current counter value and stores the next one. Only callable
     * from inside a transaction, so the increment commits or rolls back together
     * with the writes that use the value.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long next() {
        AppSetting setting = lockCounter();
        long value = setting.longValue();
        setting.assign(value + 1);
        settingRepository.save(setting);
        return value;
    }

    @Transactional(readOnly = true)
    public long current() {
        return settingRepository.findBySettingKey(KEY_GLOBAL_PALLET_COUNTER)
                .map(AppSetting::longValue)
                .orElse(0L);
    }

    /**
     * Administrative override; may move the counter backwards.
     *
     * @return the value replaced, read under the same lock
     */
    @Transactional
    public long set(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Pallet counter cannot be negative: " + value);
        }
        AppSetting setting = lockCounter();
        long previous = setting.longValue();
        setting.assign(value);
        settingRepository.save(setting);
        logger.warn("Global pallet counter overridden from {} to {}", previous, value);
        return previous;
    }

    @Transactional
    public void ensureInitialized() {
        if (settingRepository.findBySettingKey(KEY_GLOBAL_PALLET_COUNTER).isEmpty()) {
            settingRepository.save(new AppSetting(KEY_GLOBAL_PALLET_COUNTER, 0L));
            logger.info("Initialized global pallet counter at 0");
        }
    }

    private AppSetting lockCounter() {
        return settingRepository.findBySettingKeyForUpdate(KEY_GLOBAL_PALLET_COUNTER)
                .orElseGet(() -> settingRepository.save(new AppSetting(KEY_GLOBAL_PALLET_COUNTER, 0L)));
    }
}
