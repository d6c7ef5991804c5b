package com.apex.decisioncore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DecisionCoreApplication {
	public static void main(String[] args) {
		SpringApplication.run(DecisionCoreApplication.class, args);
	}
}
