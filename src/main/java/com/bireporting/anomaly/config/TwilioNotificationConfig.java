package com.bireporting.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Twilio SMS / WhatsApp delivery of anomaly alerts. Disabled unless credentials are set.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String toNumber;
    private String channel = "sms";  // "sms" or "whatsapp"
}
