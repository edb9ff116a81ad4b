package com.gold.ledger.gold_ledger;

import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import com.gold.ledger.gold_ledger.repositories.GoldRateRepository;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class MongoStartUpCheck {

    @Autowired
    MongoTemplate mongoTemplate;

    @Autowired
    GoldRateRepository goldRateRepository;

    @PostConstruct
    public void checkMongoConnection() {
        try {
            Document ping = mongoTemplate.executeCommand(new Document("ping", 1));
            log.info("MongoDB connection successful ({}): {}", mongoTemplate.getDb().getName(), ping.toJson());
        } catch (Exception e) {
            throw new IllegalStateException("MongoDB connection failed", e);
        }

        if (goldRateRepository.countByActiveTrue() == 0) {
            log.warn("No active gold rate found - trades will be rejected until an admin publishes one");
        }
    }
}
