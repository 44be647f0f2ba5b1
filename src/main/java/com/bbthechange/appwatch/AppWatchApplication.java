package com.bbthechange.appwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AppWatchApplication {

	public static void main(String[] args) {
		SpringApplication.run(AppWatchApplication.class, args);
	}

}
