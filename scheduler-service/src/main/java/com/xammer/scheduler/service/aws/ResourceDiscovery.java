package com.xammer.scheduler.service.aws;

import com.xammer.scheduler.domain.ResourceType;
import com.xammer.scheduler.domain.ScheduledResource;

import java.util.List;

/**
 * Lists the resources of one type that are candidates for scheduling.
 */
public interface ResourceDiscovery {

    ResourceType getResourceType();

    List<ScheduledResource> discover();
}
