package com.rebenew.watchParty.syncserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WatchSyncServerApplication {
	public static void main(String[] args) {
		SpringApplication.run(WatchSyncServerApplication.class, args);
	}
}
