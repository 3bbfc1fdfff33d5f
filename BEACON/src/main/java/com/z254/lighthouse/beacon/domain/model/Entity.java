package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The advertising object under evaluation. Optional coordinates are null when unknown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Entity {

    private String id;

    private EntityType type;

    /** Product or brand the entity belongs to */
    private String product;

    private String market;

    private String campaign;

    private String adGroup;

    private String keyword;

    private String url;
}
