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
@Document(collectionName = "telemetry_readings")
public class ReadingEntity {

    @DocumentId
    private String id; // {channelId}_{epochSecond}

    private String channelId;
    private Instant readingTimestamp;
    // Range queries run on this field.
    private long epochSecond;

    private Double energyKwh;
    private Double powerKw;
    private Double voltageV;
    private Double currentA;
    private Double powerFactor;
    private Double temperatureC;
    private Instant ingestedTimestamp;

    public static String documentId(String channelId, Instant timestamp) {
        return channelId + "_" + timestamp.getEpochSecond();
    }
}
