package com.example.media_analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class MediaAnalyzerApplication {

	public static void main(String[] args) {
		SpringApplication.run(MediaAnalyzerApplication.class, args);
	}

}
