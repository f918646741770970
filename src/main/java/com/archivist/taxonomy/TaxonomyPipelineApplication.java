package com.archivist.taxonomy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.retry.annotation.EnableRetry;

import java.util.Arrays;

@EnableRetry
@SpringBootApplication
@ConfigurationPropertiesScan
public class TaxonomyPipelineApplication {

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(TaxonomyPipelineApplication.class);
		boolean command = Arrays.stream(args).anyMatch(arg -> arg.startsWith("--pipeline.command"));
		if (command) {
			application.setWebApplicationType(WebApplicationType.NONE);
		}
		ConfigurableApplicationContext context = application.run(args);
		if (command) {
			System.exit(SpringApplication.exit(context));
		}
	}
}
