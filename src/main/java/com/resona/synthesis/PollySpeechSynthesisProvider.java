package com.resona.synthesis;

import com.resona.exception.FatalSynthesisException;
import com.resona.exception.TransientDependencyException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.polly.PollyClient;
import software.amazon.awssdk.services.polly.model.DescribeVoicesRequest;
import software.amazon.awssdk.services.polly.model.PollyException;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechRequest;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechResponse;

/**
 * Amazon Polly speech synthesis provider.
 */
@Slf4j
public class PollySpeechSynthesisProvider implements SpeechSynthesisProvider {

    private final PollyClient pollyClient;
    private final String name;

    public PollySpeechSynthesisProvider(PollyClient pollyClient, String region) {
        this.pollyClient = pollyClient;
        this.name = "polly-" + region;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public byte[] synthesize(String text, String voiceId, String format, String engine) {
        log.info("Forwarding synthesis request to {}: voice={}, format={}, engine={}, chars={}",
                name, voiceId, format, engine, text.length());

        SynthesizeSpeechRequest request = SynthesizeSpeechRequest.builder()
                .text(text)
                .voiceId(voiceId)
                .outputFormat(format)
                .engine(engine)
                .build();

        try {
            ResponseBytes<SynthesizeSpeechResponse> audio = pollyClient.synthesizeSpeechAsBytes(request);
            byte[] payload = audio.asByteArray();
            log.debug("Received {}B of audio from {}", payload.length, name);
            return payload;
        } catch (PollyException e) {
            if (e.isThrottlingException() || e.statusCode() >= 500) {
                throw new TransientDependencyException(name, "synthesis failed: " + e.getMessage(), e);
            }
            throw new FatalSynthesisException(name + " rejected synthesis request: " + e.getMessage(), e);
        } catch (SdkClientException e) {
            throw new TransientDependencyException(name, "synthesis failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void checkAvailable() {
        try {
            pollyClient.describeVoices(DescribeVoicesRequest.builder().build());
        } catch (PollyException | SdkClientException e) {
            throw new TransientDependencyException(name, "unavailable: " + e.getMessage(), e);
        }
    }
}
