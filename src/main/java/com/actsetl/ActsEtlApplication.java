package com.actsetl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ActsEtl - eISB to Akoma Ntoso conversion service.
 */
@SpringBootApplication
public class ActsEtlApplication {

	public static void main(String[] args) {
		SpringApplication.run(ActsEtlApplication.class, args);
	}

}
