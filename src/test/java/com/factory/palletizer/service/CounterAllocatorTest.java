package com.factory.palletizer.service;

import com.factory.palletizer.model.AppSetting;
import com.factory.palletizer.repository.AppSettingRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CounterAllocatorTest {

    @Mock
    private AppSettingRepository settingRepository;

    @InjectMocks
    private CounterAllocator counterAllocator;

    private static AppSetting counter(String storedValue) {
        AppSetting setting = new AppSetting();
        setting.setSettingKey(CounterAllocator.KEY_GLOBAL_PALLET_COUNTER);
        setting.setSettingValue(storedValue);
        return setting;
    }

    @Test
    void next_ShouldReturnCurrentValueAndStoreIncrement() {
        AppSetting setting = counter("41");
        when(settingRepository.findBySettingKeyForUpdate(CounterAllocator.KEY_GLOBAL_PALLET_COUNTER))
                .thenReturn(Optional.of(setting));

        long value = counterAllocator.next();

        assertEquals(41L, value);
        assertEquals("42", setting.getSettingValue());
        verify(settingRepository).save(setting);
    }

    @Test
    void next_ShouldStartAtZero_IfCounterMissing() {
        when(settingRepository.findBySettingKeyForUpdate(CounterAllocator.KEY_GLOBAL_PALLET_COUNTER))
                .thenReturn(Optional.empty());
        when(settingRepository.save(any(AppSetting.class))).thenAnswer(i -> i.getArguments()[0]);

        assertEquals(0L, counterAllocator.next());
    }

    @Test
    void next_ShouldFail_IfStoredValueIsNotANumber() {
        when(settingRepository.findBySettingKeyForUpdate(CounterAllocator.KEY_GLOBAL_PALLET_COUNTER))
                .thenReturn(Optional.of(counter("abc")));

        assertThrows(IllegalStateException.class, () -> counterAllocator.next());
        verify(settingRepository, never()).save(any());
    }

    @Test
    void set_ShouldAllowRewind() {
        AppSetting setting = counter("120");
        when(settingRepository.findBySettingKeyForUpdate(CounterAllocator.KEY_GLOBAL_PALLET_COUNTER))
                .thenReturn(Optional.of(setting));

        long previous = counterAllocator.set(7);

        assertEquals(120L, previous);
        assertEquals("7", setting.getSettingValue());
        verify(settingRepository).save(setting);
    }

    @Test
    void set_ShouldRejectNegativeValue() {
        assertThrows(IllegalArgumentException.class, () -> counterAllocator.set(-1));
        verifyNoInteractions(settingRepository);
    }

    @Test
    void current_ShouldDefaultToZero() {
        when(settingRepository.findBySettingKey(CounterAllocator.KEY_GLOBAL_PALLET_COUNTER))
                .thenReturn(Optional.empty());

        assertEquals(0L, counterAllocator.current());
    }
}
