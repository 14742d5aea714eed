package com.comma.counseling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@EnableFeignClients
@SpringBootApplication
public class CounselingApplication {

	public static void main(String[] args) {
		SpringApplication.run(CounselingApplication.class, args);
	}

}
