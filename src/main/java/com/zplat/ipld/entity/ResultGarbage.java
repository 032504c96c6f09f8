package com.zplat.ipld.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@NoArgsConstructor
@Entity
@Table(name = "results_garb", indexes = @Index(name = "idx_garb_row_key", columnList = "row_key"))
public class ResultGarbage extends AbstractIplResult {
}
