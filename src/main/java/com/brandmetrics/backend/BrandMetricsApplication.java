package com.brandmetrics.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class BrandMetricsApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext context = SpringApplication.run(BrandMetricsApplication.class, args);

		// one-shot mode leaves the web server running otherwise
		if (context.getEnvironment().getProperty("refresher.run-once", Boolean.class, false)) {
			System.exit(SpringApplication.exit(context));
		}
	}

}
