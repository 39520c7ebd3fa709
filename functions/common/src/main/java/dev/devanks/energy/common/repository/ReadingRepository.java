package dev.devanks.energy.common.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.common.entity.ReadingEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ReadingRepository extends FirestoreReactiveRepository<ReadingEntity> {

    Flux<ReadingEntity> findByChannelIdAndEpochSecondGreaterThanEqualAndEpochSecondLessThanOrderByEpochSecond(
            String channelId, long startInclusive, long endExclusive);
}
