package dev.devanks.energy.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

@Configuration
public class FirestoreTransactionConfig {

    /**
     * Wraps store calls that must read and write one document atomically.
     * The transaction manager is the Firestore one registered by the data starter.
     */
    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager firestoreTransactionManager) {
        return TransactionalOperator.create(firestoreTransactionManager);
    }
}
