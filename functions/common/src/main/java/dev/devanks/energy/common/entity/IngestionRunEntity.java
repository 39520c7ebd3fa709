package dev.devanks.energy.common.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "ingestion_runs")
public class IngestionRunEntity {

    @DocumentId
    private String id;

    private String channelId;
    private Instant windowStart;
    private Instant windowEnd;
    private long windowStartEpoch;
    private long windowEndEpoch;
    private int fetchedCount;
    private int insertedCount;
    private int rejectedCount;
    private String status;
    private String error;
    private Instant recordedAt;
}
