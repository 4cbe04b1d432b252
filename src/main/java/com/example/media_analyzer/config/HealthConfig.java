package com.example.media_analyzer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(HealthConfig.class);

    @Bean
    public HealthIndicator ffmpegHealth(@Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin) {
        return () -> binaryHealth("ffmpeg", ffmpegBin);
    }

    @Bean
    public HealthIndicator ffprobeHealth(@Value("${ffmpeg.probe-binary:ffprobe}") String ffprobeBin) {
        return () -> binaryHealth("ffprobe", ffprobeBin);
    }

    private static Health binaryHealth(String name, String bin) {
        try {
            var p = new ProcessBuilder(bin, "-version").redirectErrorStream(true).redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
            if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                return Health.up().withDetail(name, "ok").build();
            }
            p.destroyForcibly();
            return Health.down().withDetail(name, "exit code non-zero").build();
        } catch (IOException e) {
            LOGGER.debug("{} health check failed bin={} err={}", name, bin, e.toString());
            return Health.down(e).withDetail(name, "missing").build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down(e).withDetail(name, "interrupted").build();
        }
    }
}
