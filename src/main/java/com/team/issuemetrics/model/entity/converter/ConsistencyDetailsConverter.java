package com.team.issuemetrics.model.entity.converter;

import com.team.issuemetrics.model.evaluation.ConsistencyDetails;
import jakarta.persistence.Converter;

@Converter
public class ConsistencyDetailsConverter extends JsonAttributeConverter<ConsistencyDetails> {

    public ConsistencyDetailsConverter() {
        super(ConsistencyDetails.class);
    }
}
