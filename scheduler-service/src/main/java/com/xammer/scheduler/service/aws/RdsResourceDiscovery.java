package com.xammer.scheduler.service.aws;

import com.xammer.scheduler.domain.ResourceTags;
import com.xammer.scheduler.domain.ResourceType;
import com.xammer.scheduler.domain.ScheduledResource;
import com.xammer.scheduler.exception.TagLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesResponse;
import software.amazon.awssdk.services.rds.model.ListTagsForResourceRequest;
import software.amazon.awssdk.services.rds.model.Tag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists RDS database instances. Multi-AZ instances cannot be stopped and are skipped;
 * tags are fetched per instance when the scheduler asks for them.
 */
@Component
public class RdsResourceDiscovery implements ResourceDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(RdsResourceDiscovery.class);

    private final RdsClient rdsClient;

    public RdsResourceDiscovery(RdsClient rdsClient) {
        this.rdsClient = rdsClient;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.RDS_INSTANCE;
    }

    @Override
    public List<ScheduledResource> discover() {
        List<ScheduledResource> resources = new ArrayList<>();
        String marker = null;
        do {
            DescribeDbInstancesResponse response = rdsClient.describeDBInstances(DescribeDbInstancesRequest.builder()
                    .marker(marker)
                    .build());

            for (DBInstance instance : response.dbInstances()) {
                String identifier = instance.dbInstanceIdentifier();
                if (Boolean.TRUE.equals(instance.multiAZ())) {
                    logger.info("Skipping Multi-AZ RDS instance {}", identifier);
                    continue;
                }
                String arn = instance.dbInstanceArn();
                resources.add(new ScheduledResource(identifier, ResourceType.RDS_INSTANCE,
                        () -> fetchTags(identifier, arn), new RdsResourceDriver(rdsClient, identifier)));
            }
            marker = response.marker();
        } while (marker != null && !marker.isEmpty());

        logger.info("Discovered {} RDS instance(s) eligible for scheduling", resources.size());
        return resources;
    }

    private ResourceTags fetchTags(String identifier, String arn) {
        try {
            List<Tag> tagList = rdsClient.listTagsForResource(ListTagsForResourceRequest.builder()
                    .resourceName(arn)
                    .build()).tagList();
            Map<String, String> map = new LinkedHashMap<>();
            for (Tag tag : tagList) {
                map.putIfAbsent(tag.key(), tag.value());
            }
            return ResourceTags.of(map);
        } catch (SdkException e) {
            throw new TagLookupException(identifier, "Could not get tags for RDS instance " + identifier
                    + ": " + e.getMessage(), e);
        }
    }
}
