package com.talent.match;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableCaching
public class TalentMatchApplication {

	public static void main(String[] args) {
		SpringApplication.run(TalentMatchApplication.class, args);
	}

}
