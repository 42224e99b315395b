/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.core;

import java.util.Objects;

/**
 * What a {@link TargetResultHandler} wants returned for each outcome.
 *
 * <p>Writers never return more than the handler asked for: a handler that only
 * counts acknowledgements should not force every writer to retain full units.</p>
 */
public record ReturnedData(Content ack, Content nack, Content error) {

    public enum Content {
        NONE,
        SERIALS,
        MESSAGES
    }

    public static final ReturnedData NONE = new ReturnedData(Content.NONE, Content.NONE, Content.NONE);
    public static final ReturnedData SERIALS = new ReturnedData(Content.SERIALS, Content.SERIALS, Content.SERIALS);
    public static final ReturnedData MESSAGES = new ReturnedData(Content.MESSAGES, Content.MESSAGES, Content.MESSAGES);

    public ReturnedData {
        Objects.requireNonNull(ack, "ack");
        Objects.requireNonNull(nack, "nack");
        Objects.requireNonNull(error, "error");
    }

    public Content forOutcome(DeliveryOutcome outcome) {
        return switch (outcome) {
            case ACK -> ack;
            case NACK -> nack;
            case ERROR -> error;
        };
    }
}
