package com.di.modelops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Model-quality monitoring, retrain policy and retrain job queue.
 * Operations are invoked by an external trigger (timer, HTTP layer); no scheduler loop runs in-process.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ModelOpsApplication {

	public static void main(String[] args) {
		SpringApplication.run(ModelOpsApplication.class, args);
	}
}
