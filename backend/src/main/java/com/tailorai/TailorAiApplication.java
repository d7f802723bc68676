package com.tailorai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TailorAi - guarded resume tailoring pipeline.
 */
@SpringBootApplication
public class TailorAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(TailorAiApplication.class, args);
	}

}
