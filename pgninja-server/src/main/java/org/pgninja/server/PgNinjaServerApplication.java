package org.pgninja.server;

import org.pgninja.server.config.PgNinjaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PgNinjaProperties.class)
public class PgNinjaServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(PgNinjaServerApplication.class, args);
	}
}
