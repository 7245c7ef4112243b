package com.xammer.scheduler.service.aws;

import com.xammer.scheduler.domain.ResourceTags;
import com.xammer.scheduler.exception.TagLookupException;

@FunctionalInterface
public interface TagSource {

    /**
     * @throws TagLookupException when the tags could not be retrieved
     */
    ResourceTags fetchTags();
}
