package com.zplat.ipld.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.*;
import lombok.experimental.FieldDefaults;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Table(name = "results_done", indexes = @Index(name = "idx_done_row_key", columnList = "row_key"))
public class ResultDone extends AbstractIplResult {

    @Column(name = "ipl_date", length = 16)
    String iplDate;             // "MMM dd, yyyy" of shutdown_begin

    @Column(name = "shutdown_duration", length = 16)
    String shutdownDuration;

    @Column(name = "poweroff_duration", length = 16)
    String poweroffDuration;

    @Column(name = "load_ipl", length = 16)
    String loadIpl;

    @Column(name = "total_duration", length = 16)
    String totalDuration;
}
