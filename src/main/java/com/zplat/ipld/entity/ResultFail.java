package com.zplat.ipld.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@NoArgsConstructor
@Entity
@Table(name = "results_fail", indexes = @Index(name = "idx_fail_row_key", columnList = "row_key"))
public class ResultFail extends AbstractIplResult {
}
