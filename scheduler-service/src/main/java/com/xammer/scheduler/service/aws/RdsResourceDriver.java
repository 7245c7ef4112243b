package com.xammer.scheduler.service.aws;

import com.xammer.scheduler.domain.ResourceState;
import com.xammer.scheduler.exception.DriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesRequest;
import software.amazon.awssdk.services.rds.model.StartDbInstanceRequest;
import software.amazon.awssdk.services.rds.model.StopDbInstanceRequest;

import java.util.Set;

public class RdsResourceDriver implements ResourceDriver {

    private static final Logger logger = LoggerFactory.getLogger(RdsResourceDriver.class);

    private static final Set<String> TRANSITIONAL_STATUSES = Set.of(
            "starting", "stopping", "rebooting", "modifying", "backing-up", "configuring-enhanced-monitoring",
            "configuring-log-exports", "upgrading", "renaming", "resetting-master-credentials", "creating");

    private final RdsClient rds;
    private final String dbInstanceIdentifier;

    public RdsResourceDriver(RdsClient rds, String dbInstanceIdentifier) {
        this.rds = rds;
        this.dbInstanceIdentifier = dbInstanceIdentifier;
    }

    @Override
    public ResourceState describe() {
        try {
            DBInstance instance = rds.describeDBInstances(DescribeDbInstancesRequest.builder()
                            .dbInstanceIdentifier(dbInstanceIdentifier)
                            .build())
                    .dbInstances().stream()
                    .findFirst()
                    .orElseThrow(() -> new DriverException(dbInstanceIdentifier,
                            "RDS instance " + dbInstanceIdentifier + " not found", null));
            return toResourceState(instance.dbInstanceStatus());
        } catch (SdkException e) {
            throw new DriverException(dbInstanceIdentifier, "Failed to describe RDS instance "
                    + dbInstanceIdentifier + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void start() {
        logger.debug("Starting RDS instance {}", dbInstanceIdentifier);
        try {
            rds.startDBInstance(StartDbInstanceRequest.builder()
                    .dbInstanceIdentifier(dbInstanceIdentifier)
                    .build());
        } catch (SdkException e) {
            throw new DriverException(dbInstanceIdentifier, "Failed to start RDS instance "
                    + dbInstanceIdentifier + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        logger.debug("Stopping RDS instance {}", dbInstanceIdentifier);
        try {
            rds.stopDBInstance(StopDbInstanceRequest.builder()
                    .dbInstanceIdentifier(dbInstanceIdentifier)
                    .build());
        } catch (SdkException e) {
            throw new DriverException(dbInstanceIdentifier, "Failed to stop RDS instance "
                    + dbInstanceIdentifier + ": " + e.getMessage(), e);
        }
    }

    static ResourceState toResourceState(String status) {
        if ("available".equals(status)) {
            return ResourceState.RUNNING;
        }
        if ("stopped".equals(status)) {
            return ResourceState.STOPPED;
        }
        if (status != null && TRANSITIONAL_STATUSES.contains(status)) {
            return ResourceState.TRANSITIONING;
        }
        return ResourceState.UNKNOWN;
    }
}
