package com.zplat.ipld.repository;

import com.zplat.ipld.entity.VaultEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VaultRepository extends JpaRepository<VaultEntry, Long> {
    Optional<VaultEntry> findFirstByUsernameOrderByIdAsc(String username);
}
