package com.takvimi;

import com.takvimi.config.TakvimiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Application entry point for the Takvimi calendar service.
 * Wires the application context and exposes the HTTP endpoints defined under the interfaces layer.
 */
@SpringBootApplication
@EnableConfigurationProperties(TakvimiProperties.class)
public class TakvimiApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(TakvimiApplication.class, args);
	}

}
