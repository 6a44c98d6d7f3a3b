package com.yerin.jobclient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JobClientApplication {

	public static void main(String[] args) {
		SpringApplication.run(JobClientApplication.class, args);
	}

}
