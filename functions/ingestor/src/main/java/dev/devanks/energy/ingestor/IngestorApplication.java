package dev.devanks.energy.ingestor;

import com.google.cloud.spring.data.firestore.repository.config.EnableReactiveFirestoreRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * Entry point for the ingestion Cloud Function. The function bean itself lives in
 * {@link dev.devanks.energy.ingestor.function.IngestFunction}.
 */
@SpringBootApplication(scanBasePackages = "dev.devanks.energy")
@EnableFeignClients
@EnableReactiveFirestoreRepositories(basePackages = "dev.devanks.energy.common.repository")
public class IngestorApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestorApplication.class, args);
    }
}
