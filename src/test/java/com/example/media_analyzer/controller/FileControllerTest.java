package com.example.media_analyzer.controller;

import com.example.media_analyzer.exception.StorageException;
import com.example.media_analyzer.service.Interfaces.StorageService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = FileController.class)
@AutoConfigureMockMvc(addFilters = false)
class FileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StorageService storage;

    @TempDir
    Path dir;

    @Test
    void streamsPublishedFrame() throws Exception {
        Path frame = Files.write(dir.resolve("frame-0002.jpg"), new byte[]{(byte) 0xFF, (byte) 0xD8, 1, 2});
        when(storage.resolveOut("analyses/j1/frames/frame-0002.jpg")).thenReturn(frame);

        mockMvc.perform(get("/v1/files/out/analyses/j1/frames/frame-0002.jpg"))
                .andExpect(status().isOk())
                .andExpect(content().bytes(new byte[]{(byte) 0xFF, (byte) 0xD8, 1, 2}));
    }

    @Test
    void missingFrameIsNotFound() throws Exception {
        when(storage.resolveOut("analyses/j1/frames/frame-0009.jpg")).thenReturn(dir.resolve("nope.jpg"));

        mockMvc.perform(get("/v1/files/out/analyses/j1/frames/frame-0009.jpg"))
                .andExpect(status().isNotFound());
    }

    @Test
    void invalidKeyIsBadRequest() throws Exception {
        when(storage.resolveOut("bad")).thenThrow(new StorageException("Invalid objectKey"));

        mockMvc.perform(get("/v1/files/out/bad"))
                .andExpect(status().isBadRequest());
    }
}
