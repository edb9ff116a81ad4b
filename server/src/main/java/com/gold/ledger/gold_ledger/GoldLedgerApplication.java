package com.gold.ledger.gold_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GoldLedgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(GoldLedgerApplication.class, args);
	}

}
