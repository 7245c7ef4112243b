package com.xammer.scheduler.service.aws;

import com.xammer.scheduler.config.SchedulerSettings;
import com.xammer.scheduler.domain.ResourceTags;
import com.xammer.scheduler.domain.ResourceType;
import com.xammer.scheduler.domain.ScheduledResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceStateName;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds EC2 instances carrying the schedule tag. Terminated instances are left out.
 */
@Component
public class Ec2ResourceDiscovery implements ResourceDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(Ec2ResourceDiscovery.class);

    private final Ec2Client ec2Client;
    private final SchedulerSettings settings;

    public Ec2ResourceDiscovery(Ec2Client ec2Client, SchedulerSettings settings) {
        this.ec2Client = ec2Client;
        this.settings = settings;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.EC2_INSTANCE;
    }

    @Override
    public List<ScheduledResource> discover() {
        List<ScheduledResource> resources = new ArrayList<>();
        String nextToken = null;
        do {
            DescribeInstancesResponse response = ec2Client.describeInstances(DescribeInstancesRequest.builder()
                    .filters(Filter.builder()
                            .name("tag:" + settings.getScheduleTagKey())
                            .values("*")
                            .build())
                    .nextToken(nextToken)
                    .build());

            for (Reservation reservation : response.reservations()) {
                for (Instance instance : reservation.instances()) {
                    if (instance.state() != null && instance.state().name() == InstanceStateName.TERMINATED) {
                        logger.debug("Skipping terminated EC2 instance {}", instance.instanceId());
                        continue;
                    }
                    ResourceTags tags = toResourceTags(instance.tags());
                    resources.add(new ScheduledResource(instance.instanceId(), ResourceType.EC2_INSTANCE,
                            () -> tags, new Ec2ResourceDriver(ec2Client, instance.instanceId())));
                }
            }
            nextToken = response.nextToken();
        } while (nextToken != null && !nextToken.isEmpty());

        logger.info("Discovered {} scheduled EC2 instance(s)", resources.size());
        return resources;
    }

    static ResourceTags toResourceTags(List<Tag> tags) {
        Map<String, String> map = new LinkedHashMap<>();
        if (tags != null) {
            for (Tag tag : tags) {
                map.putIfAbsent(tag.key(), tag.value());
            }
        }
        return ResourceTags.of(map);
    }
}
