package com.example.main_image_selection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MainImageSelectionApplication {

	public static void main(String[] args) {
		SpringApplication.run(MainImageSelectionApplication.class, args);
	}

}
