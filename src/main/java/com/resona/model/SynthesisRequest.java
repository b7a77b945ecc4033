package com.resona.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Speech synthesis request for a single alert message.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SynthesisRequest {

    @JsonProperty("text")
    private String text;

    @JsonProperty("voice_id")
    private String voiceId;

    @JsonProperty("output_format")
    private String outputFormat;

    @JsonProperty("engine")
    private String engine;
}
