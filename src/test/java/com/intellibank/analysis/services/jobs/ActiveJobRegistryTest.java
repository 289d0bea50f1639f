package com.intellibank.analysis.services.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.intellibank.analysis.exceptions.DuplicateJobException;

class ActiveJobRegistryTest {

    private final ActiveJobRegistry registry = new ActiveJobRegistry();

    @Test
    void register_allowsOneActiveJobPerUpload() {
        UUID first = UUID.randomUUID();
        registry.register("upload-1", first);

        assertThatThrownBy(() -> registry.register("upload-1", UUID.randomUUID()))
                .isInstanceOf(DuplicateJobException.class);
        assertThat(registry.activeJobFor("upload-1")).contains(first);

        registry.register("upload-2", UUID.randomUUID());
        assertThat(registry.activeCount()).isEqualTo(2);
    }

    @Test
    void release_freesTheUploadForANewJob() {
        UUID first = UUID.randomUUID();
        registry.register("upload-1", first);

        registry.release("upload-1", first);

        assertThat(registry.activeJobFor("upload-1")).isEmpty();
        assertThat(registry.runOf(first)).isEmpty();
        UUID second = UUID.randomUUID();
        registry.register("upload-1", second);
        assertThat(registry.activeJobFor("upload-1")).contains(second);
    }

    @Test
    void release_byAStaleJobDoesNotFreeTheUpload() {
        UUID active = UUID.randomUUID();
        registry.register("upload-1", active);

        registry.release("upload-1", UUID.randomUUID());

        assertThat(registry.activeJobFor("upload-1")).contains(active);
    }

    @Test
    void cancel_marksTheRunInactive() {
        UUID jobId = UUID.randomUUID();
        JobRun run = registry.register("upload-1", jobId);

        assertThat(registry.cancel(jobId)).isTrue();
        assertThat(run.isActive()).isFalse();
        assertThat(registry.cancel(UUID.randomUUID())).isFalse();
    }
}
