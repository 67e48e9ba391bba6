package com.padelrank.padelrank_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PadelrankApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(PadelrankApiApplication.class, args);
	}

}
