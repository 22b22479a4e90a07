package com.sporetrack.api.dto;

import lombok.Data;

@Data
public class AmendReadingRequest {

    /** Replacement raw reading; null marks the observation pending reprocessing again. */
    private Double rawReading;
}
