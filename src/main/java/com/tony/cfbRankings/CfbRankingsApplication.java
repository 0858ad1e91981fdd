package com.tony.cfbRankings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CfbRankingsApplication {

	public static void main(String[] args) {
		SpringApplication.run(CfbRankingsApplication.class, args);
	}

}
