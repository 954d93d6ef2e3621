package org.iceforge.pgpulse;

import org.iceforge.pgpulse.config.PgPulseProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PgPulseProperties.class)
public class PgPulseApplication {

	public static void main(String[] args) {
		SpringApplication.run(PgPulseApplication.class, args);
	}
}
