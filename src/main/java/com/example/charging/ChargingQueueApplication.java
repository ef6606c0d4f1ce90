package com.example.charging;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChargingQueueApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChargingQueueApplication.class, args);
	}

}
