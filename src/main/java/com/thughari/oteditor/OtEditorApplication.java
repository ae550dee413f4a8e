package com.thughari.oteditor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OtEditorApplication {

	public static void main(String[] args) {
		SpringApplication.run(OtEditorApplication.class, args);
	}

}
