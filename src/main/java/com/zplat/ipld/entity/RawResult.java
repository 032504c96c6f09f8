package com.zplat.ipld.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

/**
 * One CSV line produced by the remote analysis scripts. Rows are only ever appended.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Table(name = "raw_results", indexes = {
        @Index(name = "idx_raw_sysname", columnList = "sysname"),
        @Index(name = "idx_raw_log_dataset", columnList = "log_dataset")
})
public class RawResult {
    public static final int SYSNAME_LENGTH = 64;
    public static final int VALUE_LENGTH = 255;
    public static final int MESSAGE_LENGTH = 1024;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "sysname", length = SYSNAME_LENGTH)
    String sysname;

    @Column(name = "log_dataset", length = VALUE_LENGTH)
    String logDataset;

    @Column(name = "shutdown_begin", length = VALUE_LENGTH)
    String shutdownBegin;

    @Column(name = "shutdown_end", length = VALUE_LENGTH)
    String shutdownEnd;

    @Column(name = "ipl_begin", length = VALUE_LENGTH)
    String iplBegin;

    @Column(name = "ipl_end", length = VALUE_LENGTH)
    String iplEnd;

    @Column(name = "pre_ipl", length = MESSAGE_LENGTH)
    String preIpl;

    @Column(name = "pos_ipl", length = MESSAGE_LENGTH)
    String posIpl;

    @Column(name = "last_ipl", length = VALUE_LENGTH)
    String lastIpl;

    @Column(name = "source_file")
    String sourceFile;

    @Column(name = "ingested_at")
    LocalDateTime ingestedAt;
}
