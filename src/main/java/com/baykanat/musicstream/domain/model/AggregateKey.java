package com.baykanat.musicstream.domain.model;

import lombok.Value;

/** (entity_type, entity_id, window_bucket) üçlüsü; tek bir rolling counter'ı tanımlar. */
@Value
public class AggregateKey {

    EntityType entityType;
    String entityId;
    WindowBucket bucket;
}
