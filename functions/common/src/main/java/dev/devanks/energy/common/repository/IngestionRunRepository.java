package dev.devanks.energy.common.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.common.entity.IngestionRunEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface IngestionRunRepository extends FirestoreReactiveRepository<IngestionRunEntity> {

    // Firestore allows range filters on a single field; the window end is filtered client-side.
    Flux<IngestionRunEntity> findByChannelIdAndWindowStartEpochLessThan(String channelId, long endExclusive);
}
