package com.xammer.scheduler.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over the tags attached to a resource.
 */
public interface ResourceTags {

    Optional<String> lookup(String key);

    static ResourceTags of(Map<String, String> tags) {
        Map<String, String> copy = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        return key -> Optional.ofNullable(copy.get(key));
    }

    static ResourceTags empty() {
        return key -> Optional.empty();
    }
}
