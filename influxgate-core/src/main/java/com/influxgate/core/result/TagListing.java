package com.influxgate.core.result;

import java.util.List;

public record TagListing(List<TagInfo> tags) {
    public TagListing {
        tags = List.copyOf(tags);
    }

    /** A tag key with a bounded sample of its observed values. */
    public record TagInfo(String key, List<String> values) {
        public TagInfo {
            values = List.copyOf(values);
        }
    }
}
