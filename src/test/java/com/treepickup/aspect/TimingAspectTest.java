package com.treepickup.aspect;

import com.treepickup.LocationFixtures;
import com.treepickup.cluster.TeamNameGenerator;
import com.treepickup.model.PartitionRequest;
import com.treepickup.model.PartitionResult;
import com.treepickup.service.ClusteringService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
public class TimingAspectTest {

    @Autowired
    private ClusteringService clusteringService;

    @Autowired
    private TeamNameGenerator teamNameGenerator;

    @Test
    public void testNoTimingRecordedReadsZero() {
        TimingAspect.getAndClearExecutionTime();
        assertEquals("0ms", TimingAspect.getAndClearExecutionTime());
    }

    @Test
    public void testTimedServiceCallRecordsDuration() {
        TimingAspect.getAndClearExecutionTime();
        PartitionRequest request = PartitionRequest.builder()
                .locations(LocationFixtures.seattleGrid(10))
                .numTeams(2)
                .teamNames(teamNameGenerator.generate(2))
                .build();

        PartitionResult result = clusteringService.partition(request);
        assertEquals(2, result.getTeams().size());

        String executionTime = TimingAspect.getAndClearExecutionTime();
        assertTrue(executionTime.endsWith("ms"));
        // Cleared after the first read
        assertEquals("0ms", TimingAspect.getAndClearExecutionTime());
    }
}
