package com.realestate.compatibility;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.core.env.Environment;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import java.util.Collections;

@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@EnableCaching
@Slf4j
public class CompatibilityApplication {

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(CompatibilityApplication.class);

		String profilesActive = System.getenv("SPRING_PROFILES_ACTIVE");
		if ((profilesActive == null || profilesActive.isEmpty()) && System.getProperty("spring.profiles.active") == null) {
			app.setDefaultProperties(Collections.singletonMap("spring.profiles.active", "dev"));
		}

		ConfigurableApplicationContext context = app.run(args);
		Environment env = context.getEnvironment();
		log.info("Compatibility audit service ready on port {} (matrix file {}, default distance {}, land use field {})",
				env.getProperty("server.port", "8080"),
				env.getProperty("compatibility.matrix.path"),
				env.getProperty("compatibility.analysis.default-adjacency-distance"),
				env.getProperty("compatibility.analysis.default-land-use-field"));
	}
}
