package com.sensorplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Bare series for the standalone statistics and DFA endpoints. */
public record SeriesRequest(@JsonProperty("values") List<Double> values) {}
