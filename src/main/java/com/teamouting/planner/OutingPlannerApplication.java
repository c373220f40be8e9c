package com.teamouting.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OutingPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(OutingPlannerApplication.class, args);
	}

}
