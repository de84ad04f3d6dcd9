package com.yerin.storyq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StoryqApplication {

	public static void main(String[] args) {
		SpringApplication.run(StoryqApplication.class, args);
	}

}
