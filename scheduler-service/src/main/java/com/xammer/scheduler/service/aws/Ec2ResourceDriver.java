package com.xammer.scheduler.service.aws;

import com.xammer.scheduler.domain.ResourceState;
import com.xammer.scheduler.exception.DriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceStateName;
import software.amazon.awssdk.services.ec2.model.StartInstancesRequest;
import software.amazon.awssdk.services.ec2.model.StopInstancesRequest;

public class Ec2ResourceDriver implements ResourceDriver {

    private static final Logger logger = LoggerFactory.getLogger(Ec2ResourceDriver.class);

    private final Ec2Client ec2;
    private final String instanceId;

    public Ec2ResourceDriver(Ec2Client ec2, String instanceId) {
        this.ec2 = ec2;
        this.instanceId = instanceId;
    }

    @Override
    public ResourceState describe() {
        try {
            DescribeInstancesResponse response = ec2.describeInstances(DescribeInstancesRequest.builder()
                    .instanceIds(instanceId)
                    .build());
            Instance instance = response.reservations().stream()
                    .flatMap(r -> r.instances().stream())
                    .findFirst()
                    .orElseThrow(() -> new DriverException(instanceId,
                            "EC2 instance " + instanceId + " not found", null));
            if (instance.state() == null) {
                return ResourceState.UNKNOWN;
            }
            return toResourceState(instance.state().name());
        } catch (SdkException e) {
            throw new DriverException(instanceId, "Failed to describe EC2 instance " + instanceId + ": "
                    + e.getMessage(), e);
        }
    }

    @Override
    public void start() {
        logger.debug("Starting EC2 instance {}", instanceId);
        try {
            ec2.startInstances(StartInstancesRequest.builder().instanceIds(instanceId).build());
        } catch (SdkException e) {
            throw new DriverException(instanceId, "Failed to start EC2 instance " + instanceId + ": "
                    + e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        logger.debug("Stopping EC2 instance {}", instanceId);
        try {
            ec2.stopInstances(StopInstancesRequest.builder().instanceIds(instanceId).build());
        } catch (SdkException e) {
            throw new DriverException(instanceId, "Failed to stop EC2 instance " + instanceId + ": "
                    + e.getMessage(), e);
        }
    }

    static ResourceState toResourceState(InstanceStateName state) {
        if (state == null) {
            return ResourceState.UNKNOWN;
        }
        switch (state) {
            case RUNNING:
                return ResourceState.RUNNING;
            case STOPPED:
                return ResourceState.STOPPED;
            case PENDING:
            case STOPPING:
            case SHUTTING_DOWN:
                return ResourceState.TRANSITIONING;
            default:
                return ResourceState.UNKNOWN;
        }
    }
}
