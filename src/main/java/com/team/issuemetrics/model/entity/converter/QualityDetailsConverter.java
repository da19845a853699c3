package com.team.issuemetrics.model.entity.converter;

import com.team.issuemetrics.model.evaluation.QualityDetails;
import jakarta.persistence.Converter;

@Converter
public class QualityDetailsConverter extends JsonAttributeConverter<QualityDetails> {

    public QualityDetailsConverter() {
        super(QualityDetails.class);
    }
}
