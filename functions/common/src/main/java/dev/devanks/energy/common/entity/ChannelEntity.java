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
@Document(collectionName = "channels")
public class ChannelEntity {

    @DocumentId
    private String id; // vendor channel id

    private String name;
    private String siteId;
    private String deviceRef;
    private String deviceType;
    private Instant updatedAt;
}
