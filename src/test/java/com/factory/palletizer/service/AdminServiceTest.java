package com.factory.palletizer.service;

import com.factory.palletizer.dto.MaterialForm;
import com.factory.palletizer.model.Material;
import com.factory.palletizer.repository.MaterialRepository;
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
class AdminServiceTest {

    @Mock
    private MaterialRepository materialRepository;
    @Mock
    private CounterAllocator counterAllocator;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private AdminService adminService;

    private MaterialForm form(String code, Integer maxQty) {
        MaterialForm form = new MaterialForm();
        form.setMaterialCode(code);
        form.setDescription(" DWP1500 LV ");
        form.setMaxQty(maxQty);
        form.setPrefix(" SL-5959 ");
        form.setAllowIncomplete(true);
        return form;
    }

    @Test
    void saveMaterial_ShouldCreateTrimmedMaterial() {
        when(materialRepository.findByMaterialCode("60115949")).thenReturn(Optional.empty());
        when(materialRepository.save(any(Material.class))).thenAnswer(i -> i.getArguments()[0]);

        Material saved = adminService.saveMaterial(form(" 60115949 ", 20));

        assertEquals("60115949", saved.getMaterialCode());
        assertEquals("DWP1500 LV", saved.getDescription());
        assertEquals("SL-5959", saved.getPrefix());
        assertEquals(20, saved.getMaxQty());
        assertTrue(saved.isActive());
        verify(auditService).log(eq("CREATE_MATERIAL"), anyString());
    }

    @Test
    void saveMaterial_ShouldUpdateExisting() {
        Material existing = new Material();
        existing.setId(4L);
        existing.setMaterialCode("60115949");
        existing.setMaxQty(20);
        when(materialRepository.findByMaterialCode("60115949")).thenReturn(Optional.of(existing));
        when(materialRepository.save(any(Material.class))).thenAnswer(i -> i.getArguments()[0]);

        MaterialForm form = form("60115949", 24);
        form.setActive(false);
        Material saved = adminService.saveMaterial(form);

        assertSame(existing, saved);
        assertEquals(24, saved.getMaxQty());
        assertFalse(saved.isActive());
        verify(auditService).log(eq("UPDATE_MATERIAL"), anyString());
    }

    @Test
    void saveMaterial_ShouldRejectZeroMaxQty() {
        assertThrows(IllegalArgumentException.class, () -> adminService.saveMaterial(form("60115949", 0)));
        verifyNoInteractions(materialRepository, auditService);
    }

    @Test
    void saveMaterial_ShouldRejectBlankCode() {
        assertThrows(IllegalArgumentException.class, () -> adminService.saveMaterial(form("  ", 20)));
        verifyNoInteractions(materialRepository);
    }

    @Test
    void setCounter_ShouldAuditValueReadUnderLock() {
        when(counterAllocator.set(12L)).thenReturn(15L);

        adminService.setCounter(12L);

        verify(counterAllocator, never()).current();
        verify(auditService).log("SET_COUNTER", "Global pallet counter: 15 -> 12");
    }
}
