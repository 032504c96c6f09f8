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
@Table(name = "lpar")
public class LparTarget {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "lpar", length = 64)
    String lpar;            // sysname, also the scheduler tag

    @Column(name = "hostname", nullable = false)
    String hostname;

    @Column(name = "dataset")
    String dataset;         // log dataset qualifier

    @Column(name = "username", length = 64)
    String username;        // ssh user, key looked up in vault

    @Column(name = "enable")
    Boolean enabled;

    @Column(name = "schedule", length = 32)
    String schedule;        // "[weekday] HH:MM"
}
