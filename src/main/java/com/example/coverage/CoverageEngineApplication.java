package com.example.coverage;

import com.example.coverage.config.CoverageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CoverageProperties.class)
public class CoverageEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(CoverageEngineApplication.class, args);
	}

}
