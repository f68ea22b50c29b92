package com.ctis.payments.domain;

import lombok.Value;

/**
 * Provider callback reduced to the two fields the engine correlates on.
 */
@Value
public class WebhookNotification {

    String externalReference;
    String resultCode;
}
