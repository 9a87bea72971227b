/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.fetcher.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.io.FileMatchers.anExistingFile;
import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(MockitoExtension.class)
class CommitableFileTest {
    @TempDir
    Path temp;
    Path testFile;

    @BeforeEach
    void beforeEach() throws Exception {
        testFile = temp.resolve("test");
        try (CommitableFile out = CommitableFile.abandonOnClose(testFile)) {
            out.write("rev1".getBytes(StandardCharsets.UTF_8));
            out.commit();
        }
        assertEquals("rev1", Files.readString(testFile));
    }

    @Test
    void GIVEN_abandon_on_close_WHEN_closed_without_commit_THEN_old_content_kept_and_temp_deleted() throws Exception {
        try (CommitableFile out = CommitableFile.abandonOnClose(testFile)) {
            out.write("rev2".getBytes(StandardCharsets.UTF_8));
            assertThat(CommitableFile.getNewFile(testFile).toFile(), anExistingFile());
        }
        assertEquals("rev1", Files.readString(testFile));
        assertThat(CommitableFile.getNewFile(testFile).toFile(), not(anExistingFile()));
    }

    @Test
    void GIVEN_commit_on_close_WHEN_closed_THEN_new_content_visible() throws Exception {
        try (CommitableFile out = CommitableFile.commitOnClose(testFile)) {
            out.write("rev2".getBytes(StandardCharsets.UTF_8));
        }
        assertEquals("rev2", Files.readString(testFile));
        assertThat(CommitableFile.getNewFile(testFile).toFile(), not(anExistingFile()));
    }

    @Test
    void GIVEN_new_file_WHEN_abandoned_THEN_nothing_under_final_name() throws Exception {
        Path fresh = temp.resolve("fresh");
        try (CommitableFile out = CommitableFile.abandonOnClose(fresh)) {
            out.write('x');
            out.write(new byte[]{'y', 'z'}, 0, 2);
            assertThat(out.getBytesWritten(), is(3L));
            assertThat(fresh.toFile(), not(anExistingFile()));
        }
        assertThat(fresh.toFile(), not(anExistingFile()));
        assertThat(CommitableFile.getNewFile(fresh).toFile(), not(anExistingFile()));
    }

    @Test
    void GIVEN_stale_temp_file_WHEN_opened_THEN_stale_content_discarded() throws Exception {
        Files.write(CommitableFile.getNewFile(testFile), "stale".getBytes(StandardCharsets.UTF_8));
        try (CommitableFile out = CommitableFile.abandonOnClose(testFile)) {
            out.write("rev3".getBytes(StandardCharsets.UTF_8));
            out.commit();
        }
        assertEquals("rev3", Files.readString(testFile));
    }

    @Test
    void GIVEN_path_WHEN_get_new_file_THEN_plus_suffixed_sibling() {
        assertEquals(temp.resolve("test+"), CommitableFile.getNewFile(testFile));
    }
}
