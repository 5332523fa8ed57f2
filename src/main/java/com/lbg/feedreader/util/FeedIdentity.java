package com.lbg.feedreader.util;

import java.util.UUID;

/**
 * Utility for generating feed identities.
 * Ids are random (version 4 UUIDs) so they carry nothing about the feed itself.
 */
public final class FeedIdentity {

    private FeedIdentity() {
        // Utility class
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }
}
