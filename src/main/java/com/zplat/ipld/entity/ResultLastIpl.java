package com.zplat.ipld.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Table(name = "results_last_ipl", indexes = @Index(name = "idx_last_ipl_sys", columnList = "sysname, last_ipl"))
public class ResultLastIpl {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "sysname", length = RawResult.SYSNAME_LENGTH)
    String sysname;

    @Column(name = "log_dataset", length = RawResult.VALUE_LENGTH)
    String logDataset;

    @Column(name = "last_ipl", length = RawResult.VALUE_LENGTH)
    String lastIpl;
}
