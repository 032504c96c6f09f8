package com.zplat.ipld.service;

import com.zplat.ipld.entity.RawResult;
import com.zplat.ipld.entity.ResultDone;
import com.zplat.ipld.entity.enumeration.IplBucket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionClassifierServiceTest {

    private static final String T0 = "2024-01-01 10:00:00";
    private static final String T1 = "2024-01-01 10:05:30";
    private static final String T2 = "2024-01-01 10:06:00";
    private static final String T3 = "2024-01-02 16:00:00";

    private static RawResult row(String sb, String se, String ib, String ie) {
        return RawResult.builder()
                .sysname("SYSA")
                .logDataset("SYS1.LOG")
                .shutdownBegin(sb)
                .shutdownEnd(se)
                .iplBegin(ib)
                .iplEnd(ie)
                .build();
    }

    @Test
    void allFourValidIsDone() {
        assertThat(IngestionClassifierService.bucketOf(row(T0, T1, T2, T3))).isEqualTo(IplBucket.DONE);
    }

    @Test
    void partialTimestampsAreFail() {
        assertThat(IngestionClassifierService.bucketOf(row(T0, null, null, null))).isEqualTo(IplBucket.FAIL);
        assertThat(IngestionClassifierService.bucketOf(row(T0, T1, T2, null))).isEqualTo(IplBucket.FAIL);
        assertThat(IngestionClassifierService.bucketOf(row(T0, T1, T2, "N/A"))).isEqualTo(IplBucket.FAIL);
    }

    @Test
    void noTimestampsIsGarbage() {
        assertThat(IngestionClassifierService.bucketOf(row(null, null, null, null))).isEqualTo(IplBucket.GARBAGE);
        assertThat(IngestionClassifierService.bucketOf(row("", " ", null, ""))).isEqualTo(IplBucket.GARBAGE);
    }

    @Test
    void doneRowCarriesComputedDurations() {
        ResultDone done = IngestionClassifierService.toDone(row(T0, T1, T2, T3), "k");

        assertThat(done.getIplDate()).isEqualTo("Jan 01, 2024");
        assertThat(done.getShutdownDuration()).isEqualTo("00:05:30");
        assertThat(done.getPoweroffDuration()).isEqualTo("00:00:30");
        assertThat(done.getLoadIpl()).isEqualTo("29:54:00");
        assertThat(done.getTotalDuration()).isEqualTo("30:00:00");
        assertThat(done.getRowKey()).isEqualTo("k");
    }
}
