package com.example.media_analyzer.config;

import com.example.media_analyzer.service.Interfaces.StorageService;
import com.example.media_analyzer.service.LocalStorageService;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public StorageService storageService(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Storage wired: base={}, rawPrefix={}, outPrefix={}", base, properties.getRawPrefix(), properties.getOutPrefix());
        return new LocalStorageService(base, properties.getRawPrefix(), properties.getOutPrefix(), properties.getPublicBaseUrl());
    }
}
