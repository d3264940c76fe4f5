package com.outreachagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Outreach Agent - staged B2B lead outreach pipeline with live progress streaming.
 */
@SpringBootApplication
public class OutreachAgentApplication {

	public static void main(String[] args) {
		SpringApplication.run(OutreachAgentApplication.class, args);
	}

}
