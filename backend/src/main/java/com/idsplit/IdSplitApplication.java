package com.idsplit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * IdSplit - program identifier splitting service.
 */
@SpringBootApplication
public class IdSplitApplication {

	public static void main(String[] args) {
		SpringApplication.run(IdSplitApplication.class, args);
	}

}
