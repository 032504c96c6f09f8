package com.zplat.ipld.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import lombok.experimental.SuperBuilder;

/**
 * Columns shared by the done/fail/garbage tables. {@code rowKey} is the hash of every
 * business column and is how duplicate rows are detected before append.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@MappedSuperclass
public abstract class AbstractIplResult {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "sysname", length = RawResult.SYSNAME_LENGTH)
    String sysname;

    @Column(name = "log_dataset", length = RawResult.VALUE_LENGTH)
    String logDataset;

    @Column(name = "shutdown_begin", length = RawResult.VALUE_LENGTH)
    String shutdownBegin;

    @Column(name = "shutdown_end", length = RawResult.VALUE_LENGTH)
    String shutdownEnd;

    @Column(name = "ipl_begin", length = RawResult.VALUE_LENGTH)
    String iplBegin;

    @Column(name = "ipl_end", length = RawResult.VALUE_LENGTH)
    String iplEnd;

    @Column(name = "pre_ipl", length = RawResult.MESSAGE_LENGTH)
    String preIpl;

    @Column(name = "pos_ipl", length = RawResult.MESSAGE_LENGTH)
    String posIpl;

    @Column(name = "row_key", length = 64, nullable = false)
    String rowKey;
}
