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
@Table(name = "vault")
public class VaultEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "username", length = 64, nullable = false)
    String username;

    @Lob
    @Column(name = "private_key")
    String privateKey;

    @Lob
    @Column(name = "public_key")
    String publicKey;
}
