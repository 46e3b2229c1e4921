package com.portfoliodevs.notifier.scheduler;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class JobIdGeneratorTest {

    @Test
    void nextId_HasSequenceAndRandomPart() {
        JobIdGenerator generator = new JobIdGenerator();

        assertThat(generator.nextId()).matches("job-1-[0-9a-f]{8}");
        assertThat(generator.nextId()).startsWith("job-2-");
    }

    @Test
    void nextId_SeparateGeneratorsDoNotCollide() {
        // Two instances model a restart: sequences overlap, the random part keeps ids apart
        Set<String> ids = new HashSet<>();
        JobIdGenerator before = new JobIdGenerator();
        JobIdGenerator after = new JobIdGenerator();
        for (int i = 0; i < 100; i++) {
            ids.add(before.nextId());
            ids.add(after.nextId());
        }

        assertThat(ids).hasSize(200);
    }
}
