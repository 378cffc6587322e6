package com.factory.palletizer.controller;

import com.factory.palletizer.dto.MaterialForm;
import com.factory.palletizer.model.Material;
import com.factory.palletizer.service.AdminService;
import com.factory.palletizer.service.CounterAllocator;
import com.factory.palletizer.service.HistoryPeriod;
import com.factory.palletizer.service.HistoryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AdminService adminService;
    @MockBean
    private CounterAllocator counterAllocator;
    @MockBean
    private HistoryService historyService;

    @Test
    @WithMockUser(roles = "ADMIN")
    void settings_ShouldExposeCounter() throws Exception {
        when(counterAllocator.current()).thenReturn(12L);

        mockMvc.perform(get("/api/admin/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.global_pallet_counter").value(12));
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void setCounter_ShouldDelegateToAdminService() throws Exception {
        when(counterAllocator.current()).thenReturn(40L);

        mockMvc.perform(put("/api/admin/settings/counter")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\":40}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.global_pallet_counter").value(40));

        verify(adminService).setCounter(40L);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void setCounter_ShouldRejectMissingValue() throws Exception {
        mockMvc.perform(put("/api/admin/settings/counter")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(adminService);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void saveMaterial_ShouldUsePathCode() throws Exception {
        Material saved = new Material();
        saved.setMaterialCode("60115949");
        saved.setMaxQty(20);
        when(adminService.saveMaterial(any(MaterialForm.class))).thenReturn(saved);

        mockMvc.perform(put("/api/admin/materials/60115949")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"DWP1500 LV\",\"maxQty\":20,\"prefix\":\"SL-5959\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.materialCode").value("60115949"));

        verify(adminService).saveMaterial(argThat(form -> "60115949".equals(form.getMaterialCode())));
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void pallets_ShouldPassIntervalFilter() throws Exception {
        LocalDate from = LocalDate.of(2024, 3, 1);
        LocalDate to = LocalDate.of(2024, 3, 31);
        when(historyService.pallets(HistoryPeriod.INTERVAL, from, to, "6011")).thenReturn(List.of());

        mockMvc.perform(get("/api/admin/pallets")
                .param("period", "INTERVAL")
                .param("from", "2024-03-01")
                .param("to", "2024-03-31")
                .param("material", "6011"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(historyService).pallets(HistoryPeriod.INTERVAL, from, to, "6011");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void drum_ShouldReturnNotFound_IfUnknown() throws Exception {
        when(historyService.findDrum("99999999")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/admin/drums/99999999"))
                .andExpect(status().isNotFound());
    }

    @Test
    @WithMockUser(roles = "OPERATOR")
    void settings_ShouldBeForbiddenForOperator() throws Exception {
        mockMvc.perform(get("/api/admin/settings"))
                .andExpect(status().isForbidden());
    }

    @Test
    void settings_ShouldAcceptConfiguredAdminCredentials() throws Exception {
        when(counterAllocator.current()).thenReturn(3L);

        mockMvc.perform(get("/api/admin/settings").with(httpBasic("admin", "admin-secret")))
                .andExpect(status().isOk());
    }

    @Test
    void settings_ShouldRejectWrongPassword() throws Exception {
        mockMvc.perform(get("/api/admin/settings").with(httpBasic("admin", "wrong")))
                .andExpect(status().isUnauthorized());
    }
}
