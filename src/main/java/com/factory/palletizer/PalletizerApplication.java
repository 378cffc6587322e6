package com.factory.palletizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PalletizerApplication {

	public static void main(String[] args) {
		SpringApplication.run(PalletizerApplication.class, args);
	}

}
