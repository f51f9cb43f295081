package club.ppmc.flowdebug.controller;

import club.ppmc.flowdebug.model.Settings;
import club.ppmc.flowdebug.model.debug.ExecutionMode;
import club.ppmc.flowdebug.service.DebugSessionService;
import club.ppmc.flowdebug.service.SettingsService;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SettingsController.class)
class SettingsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SettingsService settingsService;

    @MockBean
    private DebugSessionService debugSessionService;

    @Test
    void getSettings_returnsCurrentValues() throws Exception {
        var settings = new Settings();
        settings.setMaxLogEntries(250);
        when(settingsService.getSettings()).thenReturn(settings);

        mockMvc.perform(get("/api/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.max_log_entries").value(250))
                .andExpect(jsonPath("$.default_execution_mode").value("DEBUG"));
    }

    @Test
    void updateSettings_savesAndAppliesToSession() throws Exception {
        mockMvc.perform(post("/api/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"max_log_entries\":20,\"log_export_directory\":\"/tmp/logs\","
                                + "\"metrics_sample_limit\":10,\"pause_timeout_seconds\":5,"
                                + "\"default_execution_mode\":\"STEP\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<Settings> captor = ArgumentCaptor.forClass(Settings.class);
        verify(settingsService).updateSettings(captor.capture());
        assertEquals(20, captor.getValue().getMaxLogEntries());
        assertEquals(ExecutionMode.STEP, captor.getValue().getDefaultExecutionMode());
        verify(debugSessionService).applySettings(captor.getValue());
    }

    @Test
    void updateSettings_withInvalidLimit_returns400() throws Exception {
        mockMvc.perform(post("/api/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"max_log_entries\":0,\"log_export_directory\":\"/tmp/logs\"}"))
                .andExpect(status().isBadRequest());

        verify(settingsService, never()).updateSettings(any());
    }

    @Test
    void updateSettings_saveFailure_returns500() throws Exception {
        doThrow(new IOException("只读文件系统")).when(settingsService).updateSettings(any());

        mockMvc.perform(post("/api/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"max_log_entries\":20,\"log_export_directory\":\"/tmp/logs\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").exists());

        verify(debugSessionService, never()).applySettings(any());
    }
}
