package com.fallacylens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FallacyLens - reasoning fallacy analysis service.
 */
@SpringBootApplication
public class FallacyLensApplication {

	public static void main(String[] args) {
		SpringApplication.run(FallacyLensApplication.class, args);
	}

}
