package dev.devanks.energy.common.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.energy.common.entity.ChannelEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ChannelRepository extends FirestoreReactiveRepository<ChannelEntity> {

    Flux<ChannelEntity> findBySiteId(String siteId);
}
