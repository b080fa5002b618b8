package com.dev.prostaff;

import com.dev.prostaff.config.JwtProperties;
import com.dev.prostaff.config.RealtimeProperties;
import com.dev.prostaff.config.RevocationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({JwtProperties.class, RevocationProperties.class, RealtimeProperties.class})
public class ProstaffApplication {

	public static void main(String[] args) {
		SpringApplication.run(ProstaffApplication.class, args);
	}

	@Bean
	Clock clock() {
		return Clock.systemUTC();
	}

}
