package com.xammer.scheduler;

import com.xammer.scheduler.service.ResourceSchedulerService;
import com.xammer.scheduler.service.SchedulerJob;
import com.xammer.scheduler.service.aws.ResourceDiscovery;
import com.xammer.scheduler.service.schedule.ScheduleEvaluator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "scheduler.enabled=false",
        "aws.region=us-east-1",
        "scheduler.evaluation.wrap-overnight=true"
})
class SchedulerApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ScheduleEvaluator evaluator;

    @Test
    void wiresSchedulerWithoutStartingTheJob() {
        assertThat(context.getBean(ResourceSchedulerService.class)).isNotNull();
        assertThat(context.getBeansOfType(ResourceDiscovery.class)).hasSize(2);
        assertThat(context.getBeansOfType(SchedulerJob.class)).isEmpty();
        assertThat(evaluator.getPolicy().isWrapOvernightWindows()).isTrue();
    }
}
