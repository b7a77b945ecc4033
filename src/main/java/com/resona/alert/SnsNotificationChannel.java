package com.resona.alert;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

/**
 * Publishes alerts to an Amazon SNS topic.
 */
@Slf4j
public class SnsNotificationChannel implements NotificationChannel {

    // SNS rejects subjects longer than 100 characters
    private static final int MAX_SUBJECT_LENGTH = 100;

    private final SnsClient snsClient;
    private final String topicArn;

    public SnsNotificationChannel(SnsClient snsClient, String topicArn) {
        this.snsClient = snsClient;
        this.topicArn = topicArn;
    }

    @Override
    public String getName() {
        return "sns";
    }

    @Override
    public void publish(String subject, String message) {
        String trimmedSubject = subject.length() > MAX_SUBJECT_LENGTH
                ? subject.substring(0, MAX_SUBJECT_LENGTH)
                : subject;
        PublishResponse response = snsClient.publish(PublishRequest.builder()
                .topicArn(topicArn)
                .subject(trimmedSubject)
                .message(message)
                .build());
        log.debug("Published alert to {}: messageId={}", topicArn, response.messageId());
    }
}
